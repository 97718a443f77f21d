package com.homelibrary.catalog.dto.request;

import jakarta.validation.constraints.Size;

/** Partial update: null fields are left unchanged. */
public record UpdateAuthorRequest(

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    String name,

    @Size(max = 2000, message = "Bio must not exceed 2000 characters")
    String bio
) {}
