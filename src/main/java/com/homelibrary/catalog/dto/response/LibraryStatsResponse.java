package com.homelibrary.catalog.dto.response;

import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.ReadingStatus;

import java.util.List;
import java.util.Map;

public record LibraryStatsResponse(
    Map<EntityKind, Long> totals,
    Map<ReadingStatus, Long> readingStatus,
    List<NamedCount> topGenres,
    List<NamedCount> topAuthors
) {
    public record NamedCount(String name, long bookCount) {}
}
