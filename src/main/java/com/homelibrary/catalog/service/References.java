package com.homelibrary.catalog.service;

import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

final class References {

    private References() {}

    /**
     * Loads every id or fails with the first one that does not exist. Duplicate ids
     * collapse; {@code null} means no links.
     */
    static <T> List<T> resolveAll(JpaRepository<T, UUID> repository, List<UUID> ids,
                                  EntityKind kind, Function<T, UUID> idOf) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Set<UUID> wanted = new LinkedHashSet<>(ids);
        List<T> found = repository.findAllById(wanted);
        if (found.size() != wanted.size()) {
            Set<UUID> foundIds = found.stream().map(idOf).collect(Collectors.toSet());
            UUID missing = wanted.stream()
                .filter(id -> !foundIds.contains(id))
                .findFirst()
                .orElseThrow();
            throw new ResourceNotFoundException(kind, missing);
        }
        return found;
    }
}
