package com.homelibrary.catalog.dto.response;

import java.time.Instant;
import java.util.UUID;

/** Genre or topic. */
public record TagResponse(
    UUID id,
    String name,
    String description,
    Instant createdAt,
    Instant updatedAt
) {}
