package com.homelibrary.catalog.dto.request;

import com.homelibrary.catalog.entity.ReadingStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ReadingProgressRequest(

    @NotNull(message = "Reading status is required")
    ReadingStatus readingStatus,

    @Size(max = 10000, message = "Notes must not exceed 10000 characters")
    String notes
) {}
