package com.homelibrary.catalog.dto.response;

import java.time.Instant;
import java.util.UUID;

public record CategoryResponse(
    UUID id,
    String name,
    String description,
    String color,
    long bookCount,
    Instant createdAt,
    Instant updatedAt
) {}
