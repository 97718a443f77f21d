package com.homelibrary.catalog.dto.response;

import java.util.List;

/**
 * @param seriesWithNoAuthors series in which the author is currently the only author
 */
public record AuthorImpactReport(
    List<EntityRef> seriesWithNoAuthors,
    boolean hasImpact
) {
    public static AuthorImpactReport of(List<EntityRef> seriesWithNoAuthors) {
        return new AuthorImpactReport(List.copyOf(seriesWithNoAuthors), !seriesWithNoAuthors.isEmpty());
    }
}
