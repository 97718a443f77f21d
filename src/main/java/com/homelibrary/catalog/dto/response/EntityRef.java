package com.homelibrary.catalog.dto.response;

import java.util.UUID;

/** Id plus display name of a linked or affected record. */
public record EntityRef(UUID id, String name) {}
