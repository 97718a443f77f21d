package com.homelibrary.catalog.dto.response;

import java.time.Instant;
import java.util.UUID;

public record PublisherResponse(
    UUID id,
    String name,
    String location,
    String website,
    long bookCount,
    Instant createdAt,
    Instant updatedAt
) {}
