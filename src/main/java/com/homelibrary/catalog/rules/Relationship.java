package com.homelibrary.catalog.rules;

import com.homelibrary.catalog.entity.EntityKind;

import java.util.Optional;

/**
 * Every entity-to-entity relationship of the catalog, read from the owner's point of view:
 * {@code AUTHOR_BOOKS} states how many books an author must have, {@code BOOK_AUTHORS}
 * how many authors a book must have. Both directions of a many-to-many share the same
 * junction table. Foreign-key relationships have no junction table.
 */
public enum Relationship {
    BOOK_PUBLISHER(EntityKind.BOOK, EntityKind.PUBLISHER, Cardinality.REQUIRED_EXACTLY_ONE, null,
            ViolationType.BOOK_WITHOUT_PUBLISHER),
    BOOK_CATEGORY(EntityKind.BOOK, EntityKind.CATEGORY, Cardinality.REQUIRED_EXACTLY_ONE, null,
            ViolationType.BOOK_WITHOUT_CATEGORY),
    BOOK_SERIES(EntityKind.BOOK, EntityKind.SERIES, Cardinality.OPTIONAL_ONE, null, null),
    BOOK_AUTHORS(EntityKind.BOOK, EntityKind.AUTHOR, Cardinality.OPTIONAL_MANY, "book_authors", null),
    BOOK_GENRES(EntityKind.BOOK, EntityKind.GENRE, Cardinality.OPTIONAL_MANY, "book_genres", null),
    BOOK_TOPICS(EntityKind.BOOK, EntityKind.TOPIC, Cardinality.OPTIONAL_MANY, "book_topics", null),

    AUTHOR_BOOKS(EntityKind.AUTHOR, EntityKind.BOOK, Cardinality.REQUIRED_MIN_ONE, "book_authors",
            ViolationType.ORPHAN_AUTHOR),
    AUTHOR_SERIES(EntityKind.AUTHOR, EntityKind.SERIES, Cardinality.OPTIONAL_MANY, "series_authors", null),
    PUBLISHER_BOOKS(EntityKind.PUBLISHER, EntityKind.BOOK, Cardinality.REQUIRED_MIN_ONE, null,
            ViolationType.ORPHAN_PUBLISHER),
    SERIES_BOOKS(EntityKind.SERIES, EntityKind.BOOK, Cardinality.REQUIRED_MIN_ONE, null,
            ViolationType.ORPHAN_SERIES),
    SERIES_AUTHORS(EntityKind.SERIES, EntityKind.AUTHOR, Cardinality.REQUIRED_MIN_ONE, "series_authors",
            ViolationType.SERIES_WITHOUT_AUTHORS),

    GENRE_BOOKS(EntityKind.GENRE, EntityKind.BOOK, Cardinality.OPTIONAL_MANY, "book_genres", null),
    TOPIC_BOOKS(EntityKind.TOPIC, EntityKind.BOOK, Cardinality.OPTIONAL_MANY, "book_topics", null),
    CATEGORY_BOOKS(EntityKind.CATEGORY, EntityKind.BOOK, Cardinality.OPTIONAL_MANY, null, null);

    private final EntityKind owner;
    private final EntityKind related;
    private final Cardinality cardinality;
    private final String junctionTable;
    private final ViolationType violation;

    Relationship(EntityKind owner, EntityKind related, Cardinality cardinality,
                 String junctionTable, ViolationType violation) {
        this.owner = owner;
        this.related = related;
        this.cardinality = cardinality;
        this.junctionTable = junctionTable;
        this.violation = violation;
    }

    public EntityKind owner() {
        return owner;
    }

    public EntityKind related() {
        return related;
    }

    public Cardinality cardinality() {
        return cardinality;
    }

    public Optional<String> junctionTable() {
        return Optional.ofNullable(junctionTable);
    }

    /** The violation reported when the owner falls below the minimum; empty for optional links. */
    public Optional<ViolationType> violation() {
        return Optional.ofNullable(violation);
    }
}
