package com.homelibrary.catalog.rules;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable tag of an {@link InvariantViolation}. The first six are findings of the
 * integrity scan; the rest are reasons a delete request is refused.
 */
public enum ViolationType {
    ORPHAN_AUTHOR("orphan-author", "each author must have at least 1 book"),
    ORPHAN_PUBLISHER("orphan-publisher", "each publisher must have at least 1 book"),
    ORPHAN_SERIES("orphan-series", "each series must have at least 1 book"),
    SERIES_WITHOUT_AUTHORS("series-without-authors", "each series must have at least 1 author"),
    BOOK_WITHOUT_PUBLISHER("book-without-publisher", "each book must have exactly 1 publisher"),
    BOOK_WITHOUT_CATEGORY("book-without-category", "each book must have exactly 1 category"),

    SOLE_SERIES_AUTHOR("sole-series-author", "a series must keep at least 1 author"),
    AUTHOR_HAS_BOOKS("author-has-books", "an author can only be deleted once no book references them"),
    PUBLISHER_HAS_BOOKS("publisher-has-books", "a publisher can only be deleted once no book references it"),
    SERIES_HAS_BOOKS("series-has-books", "a series can only be deleted once no book belongs to it"),
    CATEGORY_HAS_BOOKS("category-has-books", "a category can only be deleted once no book references it"),
    DEFAULT_CATEGORY("default-category", "the default category cannot be deleted");

    private final String code;
    private final String rule;

    ViolationType(String code, String rule) {
        this.code = code;
        this.rule = rule;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String rule() {
        return rule;
    }
}
