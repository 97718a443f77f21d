package com.homelibrary.catalog.exception;

import com.homelibrary.catalog.entity.EntityKind;

public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(EntityKind kind, String field, Object value) {
        super(kind.displayName() + " " + field + " already exists: " + value);
    }
}
