package com.homelibrary.catalog.dto.response;

import com.homelibrary.catalog.entity.EntityKind;

import java.util.List;
import java.util.UUID;

/** Records removed by a book delete, the book itself first. */
public record DeleteResult(List<DeletedEntity> deletedEntities) {

    public record DeletedEntity(EntityKind kind, UUID id, String name) {}
}
