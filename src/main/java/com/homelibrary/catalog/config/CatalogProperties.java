package com.homelibrary.catalog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Catalog settings bound from the {@code catalog.*} namespace.
 */
@Component
@ConfigurationProperties(prefix = "catalog")
@Getter
@Setter
public class CatalogProperties {

    /** Seeded category that always exists and cannot be deleted. */
    private UUID defaultCategoryId = UUID.fromString("00000000-0000-4000-8000-000000000001");

    /** Version stamped on exports; imports without a version are rejected. */
    private String exportFormatVersion = "1.0.0";

    private int statsTopLimit = 5;
}
