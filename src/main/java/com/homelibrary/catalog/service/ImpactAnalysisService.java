package com.homelibrary.catalog.service;

import com.homelibrary.catalog.dto.request.BookFields;
import com.homelibrary.catalog.dto.response.AuthorImpactReport;
import com.homelibrary.catalog.dto.response.BookImpactReport;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.dto.response.IntegrityReport;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Book;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.Publisher;
import com.homelibrary.catalog.entity.Series;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.mapper.AuthorMapper;
import com.homelibrary.catalog.mapper.PublisherMapper;
import com.homelibrary.catalog.mapper.SeriesMapper;
import com.homelibrary.catalog.repository.AuthorRepository;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.EntityReference;
import com.homelibrary.catalog.repository.PublisherRepository;
import com.homelibrary.catalog.repository.SeriesRepository;
import com.homelibrary.catalog.rules.Cardinality;
import com.homelibrary.catalog.rules.InvariantViolation;
import com.homelibrary.catalog.rules.Relationship;
import com.homelibrary.catalog.rules.RelationshipCatalog;
import com.homelibrary.catalog.rules.ViolationType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only analysis of what a mutation would leave below its minimum cardinality.
 *
 * <p>Every method joins the caller's transaction when one is open, so the lifecycle
 * services see the same snapshot they are about to mutate. Nothing here throws for a
 * risky mutation; callers decide whether a non-empty report blocks. The only exception is
 * {@link ResourceNotFoundException} for an unknown id.
 *
 * <p>Counts are taken with the candidate book still persisted, which is why the
 * orphan threshold is an exact count of one.
 */
@Service
@RequiredArgsConstructor
public class ImpactAnalysisService {

    private final BookRepository bookRepository;
    private final AuthorRepository authorRepository;
    private final PublisherRepository publisherRepository;
    private final SeriesRepository seriesRepository;

    @Transactional(readOnly = true)
    public BookImpactReport checkDeleteImpact(UUID bookId) {
        Book book = loadBook(bookId);
        return analyse(book.getAuthors(), book.getPublisher(), book.getSeries());
    }

    /**
     * Same as {@link #checkDeleteImpact} but only for the links the proposed state drops:
     * removed authors, a replaced publisher, a replaced or cleared series.
     */
    @Transactional(readOnly = true)
    public BookImpactReport checkUpdateImpact(UUID bookId, BookFields proposed) {
        Book book = loadBook(bookId);

        Set<UUID> keptAuthorIds = proposed.authorIds() != null
            ? new HashSet<>(proposed.authorIds())
            : Set.of();
        List<Author> removedAuthors = book.getAuthors().stream()
            .filter(author -> !keptAuthorIds.contains(author.getId()))
            .toList();

        Publisher oldPublisher = Objects.equals(book.getPublisher().getId(), proposed.publisherId())
            ? null
            : book.getPublisher();

        Series oldSeries = book.getSeries();
        if (oldSeries != null && oldSeries.getId().equals(proposed.seriesId())) {
            oldSeries = null;
        }

        return analyse(removedAuthors, oldPublisher, oldSeries);
    }

    @Transactional(readOnly = true)
    public AuthorImpactReport checkAuthorDeleteImpact(UUID authorId) {
        if (!authorRepository.existsById(authorId)) {
            throw new ResourceNotFoundException(EntityKind.AUTHOR, authorId);
        }
        List<EntityRef> series = seriesRepository.findWhereSoleAuthor(authorId).stream()
            .map(SeriesMapper::toRef)
            .sorted(Comparator.comparing(EntityRef::name))
            .toList();
        return AuthorImpactReport.of(series);
    }

    @Transactional(readOnly = true)
    public IntegrityReport integrityCheck() {
        List<InvariantViolation> violations = new ArrayList<>();

        List<Author> orphanAuthors = authorRepository.findOrphans();
        orphanAuthors.forEach(a -> violations.add(belowMinimum(Relationship.AUTHOR_BOOKS, a.getId(), a.getName())));

        List<Publisher> orphanPublishers = publisherRepository.findOrphans();
        orphanPublishers.forEach(p -> violations.add(belowMinimum(Relationship.PUBLISHER_BOOKS, p.getId(), p.getName())));

        List<Series> orphanSeries = seriesRepository.findOrphans();
        orphanSeries.forEach(s -> violations.add(belowMinimum(Relationship.SERIES_BOOKS, s.getId(), s.getName())));

        List<Series> authorless = seriesRepository.findWithoutAuthors();
        authorless.forEach(s -> violations.add(belowMinimum(Relationship.SERIES_AUTHORS, s.getId(), s.getName())));

        List<EntityReference> withoutPublisher = bookRepository.findWithoutPublisher();
        withoutPublisher.forEach(b -> violations.add(belowMinimum(Relationship.BOOK_PUBLISHER, b.getId(), b.getName())));

        List<EntityReference> withoutCategory = bookRepository.findWithoutCategory();
        withoutCategory.forEach(b -> violations.add(belowMinimum(Relationship.BOOK_CATEGORY, b.getId(), b.getName())));

        IntegrityReport.Summary summary = new IntegrityReport.Summary(
            orphanAuthors.size(),
            orphanPublishers.size(),
            orphanSeries.size(),
            authorless.size(),
            withoutPublisher.size(),
            withoutCategory.size()
        );
        return new IntegrityReport(violations.isEmpty(), violations, summary);
    }

    private Book loadBook(UUID bookId) {
        return bookRepository.findByIdWithRelations(bookId)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.BOOK, bookId));
    }

    /**
     * Core check shared by delete and update. Each argument is a link about to be removed;
     * a null publisher or series means that link stays.
     */
    private BookImpactReport analyse(Collection<Author> detachedAuthors, Publisher detachedPublisher,
                                     Series detachedSeries) {
        List<Author> doomedAuthors = detachedAuthors.stream()
            .filter(author -> RelationshipCatalog.wouldBeOrphaned(Relationship.AUTHOR_BOOKS,
                authorRepository.countBooksByAuthorId(author.getId())))
            .sorted(Comparator.comparing(Author::getName))
            .toList();
        List<EntityRef> orphanedAuthors = doomedAuthors.stream()
            .map(AuthorMapper::toRef)
            .toList();

        EntityRef orphanedPublisher = null;
        if (detachedPublisher != null && RelationshipCatalog.wouldBeOrphaned(Relationship.PUBLISHER_BOOKS,
                bookRepository.countByPublisherId(detachedPublisher.getId()))) {
            orphanedPublisher = PublisherMapper.toRef(detachedPublisher);
        }

        EntityRef orphanedSeries = null;
        if (detachedSeries != null && RelationshipCatalog.wouldBeOrphaned(Relationship.SERIES_BOOKS,
                bookRepository.countBySeriesId(detachedSeries.getId()))) {
            orphanedSeries = SeriesMapper.toRef(detachedSeries);
        }

        UUID doomedSeriesId = orphanedSeries != null ? orphanedSeries.id() : null;
        Set<UUID> doomedAuthorIds = doomedAuthors.stream()
            .map(Author::getId)
            .collect(Collectors.toSet());
        Map<UUID, EntityRef> losingLastAuthor = new LinkedHashMap<>();
        for (Author author : doomedAuthors) {
            for (Series series : author.getSeries()) {
                if (series.getId().equals(doomedSeriesId) || losingLastAuthor.containsKey(series.getId())) {
                    continue;
                }
                // every remaining author of the series is about to be cascaded
                boolean keepsAnAuthor = series.getAuthors().stream()
                    .anyMatch(coAuthor -> !doomedAuthorIds.contains(coAuthor.getId()));
                if (!keepsAnAuthor) {
                    losingLastAuthor.put(series.getId(), SeriesMapper.toRef(series));
                }
            }
        }

        return BookImpactReport.of(orphanedAuthors, orphanedPublisher, orphanedSeries,
            new ArrayList<>(losingLastAuthor.values()));
    }

    /** Violation for an owner that fails the minimum of {@code relationship}. */
    private static InvariantViolation belowMinimum(Relationship relationship, UUID id, String name) {
        ViolationType type = relationship.violation().orElseThrow();
        String related = relationship.related().displayName().toLowerCase();
        String problem = relationship.cardinality() == Cardinality.REQUIRED_EXACTLY_ONE
            ? "references a missing " + related
            : "has no " + related + "s";
        return InvariantViolation.of(type, relationship.owner(), id, name, problem);
    }
}
