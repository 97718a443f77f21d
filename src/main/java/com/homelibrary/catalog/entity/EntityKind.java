package com.homelibrary.catalog.entity;

/**
 * The seven primary record kinds of the catalog. Used to tag impact reports, violation
 * records and import counts.
 */
public enum EntityKind {
    BOOK("Book"),
    AUTHOR("Author"),
    PUBLISHER("Publisher"),
    SERIES("Series"),
    GENRE("Genre"),
    TOPIC("Topic"),
    CATEGORY("Category");

    private final String displayName;

    EntityKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
