package com.homelibrary.catalog.unit.rules;

import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.rules.Cardinality;
import com.homelibrary.catalog.rules.InvariantViolation;
import com.homelibrary.catalog.rules.Relationship;
import com.homelibrary.catalog.rules.RelationshipCatalog;
import com.homelibrary.catalog.rules.ViolationType;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelationshipCatalogTest {

    @Test
    void minimumSatisfied_requiredRelationship_needsAtLeastOneLink() {
        assertThat(RelationshipCatalog.minimumSatisfied(Relationship.AUTHOR_BOOKS, 0)).isFalse();
        assertThat(RelationshipCatalog.minimumSatisfied(Relationship.AUTHOR_BOOKS, 1)).isTrue();
        assertThat(RelationshipCatalog.minimumSatisfied(Relationship.SERIES_AUTHORS, 3)).isTrue();
    }

    @Test
    void minimumSatisfied_optionalRelationship_alwaysTrue() {
        assertThat(RelationshipCatalog.minimumSatisfied(Relationship.GENRE_BOOKS, 0)).isTrue();
        assertThat(RelationshipCatalog.minimumSatisfied(Relationship.BOOK_SERIES, 0)).isTrue();
    }

    @Test
    void wouldBeOrphaned_usesExactThresholdOfOne() {
        assertThat(RelationshipCatalog.wouldBeOrphaned(Relationship.PUBLISHER_BOOKS, 1)).isTrue();
        assertThat(RelationshipCatalog.wouldBeOrphaned(Relationship.PUBLISHER_BOOKS, 2)).isFalse();
        assertThat(RelationshipCatalog.wouldBeOrphaned(Relationship.GENRE_BOOKS, 1)).isFalse();
    }

    @Test
    void wouldBeOrphaned_withZeroCount_throwsIllegalStateException() {
        assertThatThrownBy(() -> RelationshipCatalog.wouldBeOrphaned(Relationship.AUTHOR_BOOKS, 0))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("AUTHOR_BOOKS");
    }

    @Test
    void relationshipTable_declaresJunctionTablesForManyToMany() {
        assertThat(Relationship.BOOK_AUTHORS.junctionTable()).contains("book_authors");
        assertThat(Relationship.AUTHOR_BOOKS.junctionTable()).contains("book_authors");
        assertThat(Relationship.SERIES_AUTHORS.junctionTable()).contains("series_authors");
        assertThat(Relationship.BOOK_PUBLISHER.junctionTable()).isEmpty();
        assertThat(Relationship.BOOK_PUBLISHER.cardinality()).isEqualTo(Cardinality.REQUIRED_EXACTLY_ONE);
    }

    @Test
    void relationshipTable_requiredLinksAllCarryAViolationType() {
        assertThat(Relationship.values())
            .filteredOn(rel -> rel.cardinality().isRequired())
            .isNotEmpty()
            .allSatisfy(rel -> assertThat(rel.violation()).isPresent());
        assertThat(Relationship.SERIES_AUTHORS.related()).isEqualTo(EntityKind.AUTHOR);
    }

    @Test
    void invariantViolation_messageNamesEntityAndRule() {
        UUID id = UUID.randomUUID();
        InvariantViolation violation = InvariantViolation.withCount(ViolationType.PUBLISHER_HAS_BOOKS,
            EntityKind.PUBLISHER, id, "Penguin", "is still linked to 2 book(s)", 2);

        assertThat(violation.message())
            .isEqualTo("Publisher \"Penguin\" is still linked to 2 book(s) "
                + "(violates: a publisher can only be deleted once no book references it)");
        assertThat(violation.linkedCount()).isEqualTo(2L);
        assertThat(violation.type().code()).isEqualTo("publisher-has-books");
    }
}
