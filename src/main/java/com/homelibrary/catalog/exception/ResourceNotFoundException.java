package com.homelibrary.catalog.exception;

import com.homelibrary.catalog.entity.EntityKind;

import java.util.UUID;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(EntityKind kind, UUID id) {
        super(kind.displayName() + " not found with id " + id);
    }
}
