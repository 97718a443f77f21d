package com.homelibrary.catalog.rules;

/**
 * Pure functions over the static {@link Relationship} table. No state, no I/O.
 */
public final class RelationshipCatalog {

    private RelationshipCatalog() {}

    public static boolean minimumSatisfied(Relationship relationship, long linkedCount) {
        if (!relationship.cardinality().isRequired()) {
            return true;
        }
        return linkedCount >= 1;
    }

    /**
     * Whether removing one link would drop the owner below its minimum.
     *
     * <p>{@code currentCount} is the persisted count <em>including</em> the link about to
     * be removed, hence the exact {@code == 1} threshold. A count of zero means the caller
     * asked about a link that is not there, which is a programming error.
     */
    public static boolean wouldBeOrphaned(Relationship relationship, long currentCount) {
        if (currentCount < 1) {
            throw new IllegalStateException(
                "Link count for " + relationship + " is " + currentCount
                    + " but must include the link being removed");
        }
        return !minimumSatisfied(relationship, currentCount - 1);
    }
}
