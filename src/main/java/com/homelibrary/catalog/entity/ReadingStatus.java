package com.homelibrary.catalog.entity;

/**
 * Reading progress of a {@link Book}.
 *
 * <p>Mapped as {@code VARCHAR} via {@code @Enumerated(EnumType.STRING)} so that
 * the stored value is always the enum name. {@code EnumType.ORDINAL} is avoided because
 * re-ordering constants would silently corrupt existing rows.
 */
public enum ReadingStatus {
    UNREAD,
    READING,
    COMPLETED
}
