package com.homelibrary.catalog.dto.response;

import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.rules.InvariantViolation;
import com.homelibrary.catalog.rules.ViolationType;

import java.util.ArrayList;
import java.util.List;

/**
 * What deleting or updating a book would leave below its minimum cardinality.
 *
 * @param orphanedAuthors        authors whose only book is the candidate
 * @param orphanedPublisher      the publisher if the candidate is its only book, else null
 * @param orphanedSeries         the series if the candidate is its only book, else null
 * @param seriesLosingLastAuthor surviving series whose authors are all among
 *                               {@code orphanedAuthors}; informational, not part of
 *                               {@code hasImpact}
 */
public record BookImpactReport(
    List<EntityRef> orphanedAuthors,
    EntityRef orphanedPublisher,
    EntityRef orphanedSeries,
    List<EntityRef> seriesLosingLastAuthor,
    boolean hasImpact
) {

    public static BookImpactReport of(List<EntityRef> orphanedAuthors, EntityRef orphanedPublisher,
                                      EntityRef orphanedSeries, List<EntityRef> seriesLosingLastAuthor) {
        boolean impact = !orphanedAuthors.isEmpty() || orphanedPublisher != null || orphanedSeries != null;
        return new BookImpactReport(List.copyOf(orphanedAuthors), orphanedPublisher, orphanedSeries,
            List.copyOf(seriesLosingLastAuthor), impact);
    }

    public List<InvariantViolation> toViolations() {
        List<InvariantViolation> violations = new ArrayList<>();
        for (EntityRef author : orphanedAuthors) {
            violations.add(InvariantViolation.of(ViolationType.ORPHAN_AUTHOR, EntityKind.AUTHOR,
                author.id(), author.name(), "would be left without books"));
        }
        if (orphanedPublisher != null) {
            violations.add(InvariantViolation.of(ViolationType.ORPHAN_PUBLISHER, EntityKind.PUBLISHER,
                orphanedPublisher.id(), orphanedPublisher.name(), "would be left without books"));
        }
        if (orphanedSeries != null) {
            violations.add(InvariantViolation.of(ViolationType.ORPHAN_SERIES, EntityKind.SERIES,
                orphanedSeries.id(), orphanedSeries.name(), "would be left without books"));
        }
        return violations;
    }

    /** Violations that block the cascade itself: deleting these authors would empty a series. */
    public List<InvariantViolation> cascadeViolations() {
        return seriesLosingLastAuthor.stream()
            .map(series -> InvariantViolation.of(ViolationType.SOLE_SERIES_AUTHOR, EntityKind.SERIES,
                series.id(), series.name(), "would lose all of its authors to orphan cleanup"))
            .toList();
    }
}
