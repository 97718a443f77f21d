package com.homelibrary.catalog.dto.response;

import java.util.List;

public record CleanupResult(
    List<EntityRef> deletedAuthors,
    List<EntityRef> deletedPublishers,
    List<EntityRef> deletedSeries
) {
    public int totalDeleted() {
        return deletedAuthors.size() + deletedPublishers.size() + deletedSeries.size();
    }
}
