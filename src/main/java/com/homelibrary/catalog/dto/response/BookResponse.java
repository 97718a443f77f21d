package com.homelibrary.catalog.dto.response;

import com.homelibrary.catalog.entity.ReadingStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record BookResponse(
    UUID id,
    String title,
    String isbn,
    Integer publicationYear,
    Integer pages,
    String description,
    String coverImage,
    ReadingStatus readingStatus,
    String notes,
    Double rating,
    EntityRef publisher,
    EntityRef category,
    EntityRef series,
    Integer seriesOrder,
    List<EntityRef> authors,
    List<EntityRef> genres,
    List<EntityRef> topics,
    Integer version,
    Instant createdAt,
    Instant updatedAt
) {}
