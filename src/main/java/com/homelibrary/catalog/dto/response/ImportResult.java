package com.homelibrary.catalog.dto.response;

import com.homelibrary.catalog.entity.EntityKind;

import java.util.List;
import java.util.Map;

/**
 * @param success  false when any record was rejected
 * @param imported newly inserted record count per kind; skipped duplicates and records
 *                 removed again by the closing orphan cleanup are not counted
 * @param errors   per-record rejections followed by post-import cleanup notes
 */
public record ImportResult(
    boolean success,
    Map<EntityKind, Integer> imported,
    List<String> errors
) {}
