package com.homelibrary.catalog.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.homelibrary.catalog.rules.InvariantViolation;

import java.util.List;

public record IntegrityReport(
    @JsonProperty("isValid") boolean isValid,
    List<InvariantViolation> violations,
    Summary summary
) {
    public record Summary(
        int orphanAuthors,
        int orphanPublishers,
        int orphanSeries,
        int seriesWithNoAuthors,
        int booksWithNoPublisher,
        int booksWithNoCategory
    ) {}
}
