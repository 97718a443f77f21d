package com.homelibrary.catalog.rules;

/**
 * How many related records the owning side of a {@link Relationship} must be linked to.
 */
public enum Cardinality {
    REQUIRED_EXACTLY_ONE(true),
    REQUIRED_MIN_ONE(true),
    OPTIONAL_ONE(false),
    OPTIONAL_MANY(false);

    private final boolean required;

    Cardinality(boolean required) {
        this.required = required;
    }

    public boolean isRequired() {
        return required;
    }
}
