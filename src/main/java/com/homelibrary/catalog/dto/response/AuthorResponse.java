package com.homelibrary.catalog.dto.response;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record AuthorResponse(
    UUID id,
    String name,
    String bio,
    List<BookSummary> books,
    List<EntityRef> series,
    Instant createdAt,
    Instant updatedAt
) {
    public record BookSummary(UUID id, String title) {}
}
