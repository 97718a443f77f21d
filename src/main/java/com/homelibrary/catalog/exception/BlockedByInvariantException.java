package com.homelibrary.catalog.exception;

import com.homelibrary.catalog.rules.InvariantViolation;

import java.util.List;

/**
 * A mutation was refused because committing it would break a cardinality rule.
 * Carries every violation found so callers can tell the user exactly which entities are
 * at risk and why. Thrown only by the lifecycle services, never by impact analysis.
 */
public class BlockedByInvariantException extends RuntimeException {

    private final transient List<InvariantViolation> violations;

    public BlockedByInvariantException(String summary, List<InvariantViolation> violations) {
        super(buildMessage(summary, violations));
        this.violations = List.copyOf(violations);
    }

    public List<InvariantViolation> getViolations() {
        return violations;
    }

    private static String buildMessage(String summary, List<InvariantViolation> violations) {
        StringBuilder sb = new StringBuilder(summary);
        for (InvariantViolation violation : violations) {
            sb.append("\n• ").append(violation.message());
        }
        return sb.toString();
    }
}
