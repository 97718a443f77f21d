package com.homelibrary.catalog.dto.response;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record SeriesResponse(
    UUID id,
    String name,
    String description,
    List<EntityRef> authors,
    long bookCount,
    Instant createdAt,
    Instant updatedAt
) {}
