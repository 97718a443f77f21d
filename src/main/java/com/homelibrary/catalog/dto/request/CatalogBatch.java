package com.homelibrary.catalog.dto.request;

import java.time.Instant;
import java.util.List;

/**
 * A whole-catalog batch: the body of {@code POST /import} and the result of
 * {@code GET /export}. Records reuse the create-request shapes so an export can be fed
 * straight back into an import. Nested records are validated one by one during import,
 * so a bad record is reported instead of failing the batch.
 */
public record CatalogBatch(
    String version,
    Instant exportedAt,
    List<CategoryRequest> categories,
    List<CreateAuthorRequest> authors,
    List<PublisherRequest> publishers,
    List<TagRequest> genres,
    List<TagRequest> topics,
    List<SeriesRequest> series,
    List<CreateBookRequest> books
) {}
