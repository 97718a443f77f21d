package com.homelibrary.catalog.service;

import com.homelibrary.catalog.dto.request.BookFields;
import com.homelibrary.catalog.dto.request.CreateBookRequest;
import com.homelibrary.catalog.dto.request.ReadingProgressRequest;
import com.homelibrary.catalog.dto.request.UpdateBookRequest;
import com.homelibrary.catalog.dto.response.BookImpactReport;
import com.homelibrary.catalog.dto.response.BookResponse;
import com.homelibrary.catalog.dto.response.DeleteResult;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Book;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.Genre;
import com.homelibrary.catalog.entity.Publisher;
import com.homelibrary.catalog.entity.Series;
import com.homelibrary.catalog.entity.Topic;
import com.homelibrary.catalog.exception.BlockedByInvariantException;
import com.homelibrary.catalog.exception.DuplicateResourceException;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.mapper.BookMapper;
import com.homelibrary.catalog.repository.AuthorRepository;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.CategoryRepository;
import com.homelibrary.catalog.repository.GenreRepository;
import com.homelibrary.catalog.repository.PublisherRepository;
import com.homelibrary.catalog.repository.SeriesRepository;
import com.homelibrary.catalog.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Book CRUD plus the guarded delete and update paths.
 *
 * <p>Delete and update first ask {@link ImpactAnalysisService} what the change would
 * orphan. Without {@code cascadeOrphans} any impact refuses the change before a single
 * write. With it, the orphans are removed in the same transaction as the book change.
 * Both paths flush before returning so a storage failure surfaces here and rolls the
 * whole change back.
 */
@Service
@RequiredArgsConstructor
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    private final BookRepository bookRepository;
    private final AuthorRepository authorRepository;
    private final PublisherRepository publisherRepository;
    private final CategoryRepository categoryRepository;
    private final SeriesRepository seriesRepository;
    private final GenreRepository genreRepository;
    private final TopicRepository topicRepository;
    private final ImpactAnalysisService impactAnalysisService;
    private final OrphanCleanupService orphanCleanupService;

    @Transactional(readOnly = true)
    public Page<BookResponse> findAll(Pageable pageable) {
        return bookRepository.findAll(pageable)
            .map(BookMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public BookResponse findById(UUID id) {
        return BookMapper.toResponse(loadBook(id));
    }

    @Transactional
    public BookResponse create(CreateBookRequest request) {
        if (request.id() != null && bookRepository.existsById(request.id())) {
            throw new DuplicateResourceException(EntityKind.BOOK, "id", request.id());
        }
        Book book = BookMapper.toEntity(request);
        applyReferences(book, request);
        Book saved = bookRepository.save(book);
        log.info("Created book '{}' ({})", saved.getTitle(), saved.getId());
        return BookMapper.toResponse(saved);
    }

    @Transactional
    public BookResponse update(UUID id, UpdateBookRequest request, boolean cascadeOrphans) {
        Book book = loadBook(id);
        BookImpactReport impact = impactAnalysisService.checkUpdateImpact(id, request);
        guard(book, impact, cascadeOrphans, "update");

        Set<UUID> orphanedAuthorIds = ids(impact.orphanedAuthors());
        List<Author> orphanedAuthors = book.getAuthors().stream()
            .filter(author -> orphanedAuthorIds.contains(author.getId()))
            .toList();
        Publisher oldPublisher = book.getPublisher();
        Series oldSeries = book.getSeries();

        BookMapper.updateEntity(book, request);
        applyReferences(book, request);
        bookRepository.saveAndFlush(book);

        if (cascadeOrphans && impact.hasImpact()) {
            List<String> removed = new ArrayList<>();
            for (Author author : orphanedAuthors) {
                orphanCleanupService.removeAuthor(author);
                removed.add("Author '" + author.getName() + "'");
            }
            if (impact.orphanedPublisher() != null) {
                orphanCleanupService.removePublisher(oldPublisher);
                removed.add("Publisher '" + oldPublisher.getName() + "'");
            }
            if (impact.orphanedSeries() != null) {
                orphanCleanupService.removeSeries(oldSeries);
                removed.add("Series '" + oldSeries.getName() + "'");
            }
            bookRepository.flush();
            log.info("Updated book '{}' ({}) and removed orphans: {}", book.getTitle(), id, removed);
        } else {
            log.info("Updated book '{}' ({})", book.getTitle(), id);
        }
        return BookMapper.toResponse(book);
    }

    @Transactional
    public DeleteResult delete(UUID id, boolean cascadeOrphans) {
        Book book = loadBook(id);
        BookImpactReport impact = impactAnalysisService.checkDeleteImpact(id);
        guard(book, impact, cascadeOrphans, "delete");

        List<DeleteResult.DeletedEntity> deleted = new ArrayList<>();
        deleted.add(new DeleteResult.DeletedEntity(EntityKind.BOOK, book.getId(), book.getTitle()));
        bookRepository.delete(book);

        if (cascadeOrphans) {
            Set<UUID> orphanedAuthorIds = ids(impact.orphanedAuthors());
            for (Author author : book.getAuthors()) {
                if (orphanedAuthorIds.contains(author.getId())) {
                    orphanCleanupService.removeAuthor(author);
                    deleted.add(new DeleteResult.DeletedEntity(EntityKind.AUTHOR, author.getId(), author.getName()));
                }
            }
            if (impact.orphanedPublisher() != null) {
                Publisher publisher = book.getPublisher();
                orphanCleanupService.removePublisher(publisher);
                deleted.add(new DeleteResult.DeletedEntity(EntityKind.PUBLISHER, publisher.getId(), publisher.getName()));
            }
            if (impact.orphanedSeries() != null) {
                Series series = book.getSeries();
                orphanCleanupService.removeSeries(series);
                deleted.add(new DeleteResult.DeletedEntity(EntityKind.SERIES, series.getId(), series.getName()));
            }
        }
        bookRepository.flush();

        log.info("Deleted book '{}' ({}), {} record(s) removed in total", book.getTitle(), id, deleted.size());
        return new DeleteResult(deleted);
    }

    @Transactional
    public BookResponse updateProgress(UUID id, ReadingProgressRequest request) {
        Book book = loadBook(id);
        book.setReadingStatus(request.readingStatus());
        if (request.notes() != null) {
            book.setNotes(request.notes());
        }
        Book saved = bookRepository.saveAndFlush(book);
        return BookMapper.toResponse(saved);
    }

    private Book loadBook(UUID id) {
        return bookRepository.findByIdWithRelations(id)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.BOOK, id));
    }

    /**
     * Refuses the change when it would orphan something and the caller did not opt in to
     * cascading, or when cascading would strip a surviving series of its last author.
     */
    private void guard(Book book, BookImpactReport impact, boolean cascadeOrphans, String operation) {
        if (!impact.hasImpact()) {
            return;
        }
        if (!cascadeOrphans) {
            log.warn("Refused to {} book {}: {} record(s) would be orphaned",
                operation, book.getId(), impact.toViolations().size());
            throw new BlockedByInvariantException(
                "Cannot " + operation + " book \"" + book.getTitle() + "\" without removing the records it leaves orphaned",
                impact.toViolations());
        }
        if (!impact.seriesLosingLastAuthor().isEmpty()) {
            log.warn("Refused cascading {} of book {}: series would lose their last author", operation, book.getId());
            throw new BlockedByInvariantException(
                "Cannot " + operation + " book \"" + book.getTitle() + "\": removing its orphaned authors would leave series without authors",
                impact.cascadeViolations());
        }
    }

    private void applyReferences(Book book, BookFields fields) {
        book.setPublisher(publisherRepository.findById(fields.publisherId())
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.PUBLISHER, fields.publisherId())));
        book.setCategory(categoryRepository.findById(fields.categoryId())
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.CATEGORY, fields.categoryId())));
        book.setSeries(fields.seriesId() == null ? null : seriesRepository.findById(fields.seriesId())
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.SERIES, fields.seriesId())));

        replace(book.getAuthors(), References.resolveAll(authorRepository, fields.authorIds(), EntityKind.AUTHOR, Author::getId));
        replace(book.getGenres(), References.resolveAll(genreRepository, fields.genreIds(), EntityKind.GENRE, Genre::getId));
        replace(book.getTopics(), References.resolveAll(topicRepository, fields.topicIds(), EntityKind.TOPIC, Topic::getId));
    }

    private static <T> void replace(Set<T> current, List<T> replacement) {
        current.retainAll(replacement);
        current.addAll(replacement);
    }

    private static Set<UUID> ids(List<EntityRef> refs) {
        return refs.stream().map(EntityRef::id).collect(Collectors.toCollection(HashSet::new));
    }
}
