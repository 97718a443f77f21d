package com.homelibrary.catalog.repository;

import java.util.UUID;

/**
 * Id/display-name projection for native integrity queries.
 */
public interface EntityReference {

    UUID getId();

    String getName();
}
