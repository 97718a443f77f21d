package com.homelibrary.catalog.rules;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.homelibrary.catalog.entity.EntityKind;

import java.util.UUID;

/**
 * One finding: which entity breaks (or would break) which rule.
 *
 * @param linkedCount number of books still linked, set only for refused single-entity deletes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvariantViolation(
    ViolationType type,
    EntityKind entityType,
    UUID entityId,
    String entityName,
    String message,
    Long linkedCount
) {

    public static InvariantViolation of(ViolationType type, EntityKind entityType,
                                        UUID entityId, String entityName, String problem) {
        return new InvariantViolation(type, entityType, entityId, entityName,
            format(entityType, entityName, problem, type), null);
    }

    public static InvariantViolation withCount(ViolationType type, EntityKind entityType,
                                               UUID entityId, String entityName,
                                               String problem, long linkedCount) {
        return new InvariantViolation(type, entityType, entityId, entityName,
            format(entityType, entityName, problem, type), linkedCount);
    }

    private static String format(EntityKind entityType, String entityName, String problem,
                                 ViolationType type) {
        return entityType.displayName() + " \"" + entityName + "\" " + problem
            + " (violates: " + type.rule() + ")";
    }
}
