package com.homelibrary.catalog.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/** Used for create and full update; {@code id} is ignored on update. */
public record PublisherRequest(

    UUID id,

    @NotBlank(message = "Name must not be blank")
    @Size(max = 255, message = "Name must not exceed 255 characters")
    String name,

    @Size(max = 255, message = "Location must not exceed 255 characters")
    String location,

    @Size(max = 500, message = "Website must not exceed 500 characters")
    @Pattern(regexp = "^(https?://\\S+)?$", message = "Website must be an http(s) URL")
    String website
) {}
