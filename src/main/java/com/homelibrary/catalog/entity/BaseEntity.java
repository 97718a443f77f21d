package com.homelibrary.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Transient;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * Shared superclass for all catalog entities.
 *
 * <p>Provides automatic audit timestamps ({@code created_at} and {@code updated_at})
 * via JPA lifecycle callbacks. The {@code created_at} column is set once on first
 * persist and is thereafter immutable ({@code updatable = false}).
 *
 * <p><strong>Identifiers are assigned by the application</strong>, not the database:
 * every record carries a stable UUID that callers may supply (import, explicit create)
 * and that survives export/import round trips. Because the id is already set before the
 * first save, Spring Data cannot use "id is null" to detect new rows. This class
 * implements {@link Persistable} and tracks newness in a transient flag, flipped after
 * the entity is persisted or loaded, so {@code save()} issues a plain INSERT instead of
 * a SELECT-then-merge.
 */
@MappedSuperclass
public abstract class BaseEntity implements Persistable<UUID> {

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private boolean newEntity = true;

    protected BaseEntity() {}

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    @PostPersist
    @PostLoad
    protected void markNotNew() {
        newEntity = false;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
