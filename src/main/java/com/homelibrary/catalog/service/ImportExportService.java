package com.homelibrary.catalog.service;

import com.homelibrary.catalog.config.CatalogProperties;
import com.homelibrary.catalog.dto.request.CatalogBatch;
import com.homelibrary.catalog.dto.request.CategoryRequest;
import com.homelibrary.catalog.dto.request.CreateAuthorRequest;
import com.homelibrary.catalog.dto.request.CreateBookRequest;
import com.homelibrary.catalog.dto.request.PublisherRequest;
import com.homelibrary.catalog.dto.request.SeriesRequest;
import com.homelibrary.catalog.dto.request.TagRequest;
import com.homelibrary.catalog.dto.response.CleanupResult;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.dto.response.ImportResult;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Book;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.Genre;
import com.homelibrary.catalog.entity.Publisher;
import com.homelibrary.catalog.entity.Series;
import com.homelibrary.catalog.entity.Topic;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.exception.ValidationException;
import com.homelibrary.catalog.mapper.AuthorMapper;
import com.homelibrary.catalog.mapper.BookMapper;
import com.homelibrary.catalog.mapper.PublisherMapper;
import com.homelibrary.catalog.mapper.SeriesMapper;
import com.homelibrary.catalog.mapper.TaxonomyMapper;
import com.homelibrary.catalog.repository.AuthorRepository;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.CategoryRepository;
import com.homelibrary.catalog.repository.GenreRepository;
import com.homelibrary.catalog.repository.PublisherRepository;
import com.homelibrary.catalog.repository.SeriesRepository;
import com.homelibrary.catalog.repository.TopicRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Whole-catalog import and export.
 *
 * <p>Import merges by identifier: a record whose id already exists is skipped, so
 * importing the same batch twice inserts nothing the second time. Groups are applied in
 * dependency order (categories, authors, publishers, genres, topics, series, books). A
 * bad record is reported and skipped; it never aborts the batch. Every reference and
 * unique name is checked before the insert so no constraint violation can reach the
 * database and poison the session. Orphans left behind are cleaned up in the same
 * transaction.
 */
@Service
@RequiredArgsConstructor
public class ImportExportService {

    private static final Logger log = LoggerFactory.getLogger(ImportExportService.class);

    private final CategoryRepository categoryRepository;
    private final AuthorRepository authorRepository;
    private final PublisherRepository publisherRepository;
    private final GenreRepository genreRepository;
    private final TopicRepository topicRepository;
    private final SeriesRepository seriesRepository;
    private final BookRepository bookRepository;
    private final OrphanCleanupService orphanCleanupService;
    private final CatalogProperties catalogProperties;
    private final Validator validator;

    @Transactional
    public ImportResult importBatch(CatalogBatch batch) {
        if (batch == null || batch.version() == null || batch.version().isBlank()) {
            throw new ValidationException("Import batch must declare a format version");
        }
        if (!batch.version().equals(catalogProperties.getExportFormatVersion())) {
            log.warn("Importing batch with format version {} (current is {})",
                batch.version(), catalogProperties.getExportFormatVersion());
        }

        Map<EntityKind, Integer> imported = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            imported.put(kind, 0);
        }
        List<String> errors = new ArrayList<>();
        // ids inserted by this batch that orphan cleanup may take back
        Set<UUID> insertedOwners = new HashSet<>();

        for (CategoryRequest record : nullSafe(batch.categories())) {
            if (record.id() != null && categoryRepository.existsById(record.id())) {
                continue;
            }
            if (isValid(EntityKind.CATEGORY, record.name(), record, errors)) {
                if (categoryRepository.existsByNameIgnoreCase(record.name())) {
                    errors.add(reject(EntityKind.CATEGORY, record.name(), "name already exists"));
                    continue;
                }
                categoryRepository.save(TaxonomyMapper.toCategory(record));
                imported.merge(EntityKind.CATEGORY, 1, Integer::sum);
            }
        }

        for (CreateAuthorRequest record : nullSafe(batch.authors())) {
            if (record.id() != null && authorRepository.existsById(record.id())) {
                continue;
            }
            if (isValid(EntityKind.AUTHOR, record.name(), record, errors)) {
                Author author = AuthorMapper.toEntity(record);
                authorRepository.save(author);
                insertedOwners.add(author.getId());
                imported.merge(EntityKind.AUTHOR, 1, Integer::sum);
            }
        }

        for (PublisherRequest record : nullSafe(batch.publishers())) {
            if (record.id() != null && publisherRepository.existsById(record.id())) {
                continue;
            }
            if (isValid(EntityKind.PUBLISHER, record.name(), record, errors)) {
                Publisher publisher = PublisherMapper.toEntity(record);
                publisherRepository.save(publisher);
                insertedOwners.add(publisher.getId());
                imported.merge(EntityKind.PUBLISHER, 1, Integer::sum);
            }
        }

        for (TagRequest record : nullSafe(batch.genres())) {
            if (record.id() != null && genreRepository.existsById(record.id())) {
                continue;
            }
            if (isValid(EntityKind.GENRE, record.name(), record, errors)) {
                if (genreRepository.existsByNameIgnoreCase(record.name())) {
                    errors.add(reject(EntityKind.GENRE, record.name(), "name already exists"));
                    continue;
                }
                genreRepository.save(TaxonomyMapper.toGenre(record));
                imported.merge(EntityKind.GENRE, 1, Integer::sum);
            }
        }

        for (TagRequest record : nullSafe(batch.topics())) {
            if (record.id() != null && topicRepository.existsById(record.id())) {
                continue;
            }
            if (isValid(EntityKind.TOPIC, record.name(), record, errors)) {
                if (topicRepository.existsByNameIgnoreCase(record.name())) {
                    errors.add(reject(EntityKind.TOPIC, record.name(), "name already exists"));
                    continue;
                }
                topicRepository.save(TaxonomyMapper.toTopic(record));
                imported.merge(EntityKind.TOPIC, 1, Integer::sum);
            }
        }

        for (SeriesRequest record : nullSafe(batch.series())) {
            if (record.id() != null && seriesRepository.existsById(record.id())) {
                continue;
            }
            if (record.authorIds() == null || record.authorIds().isEmpty()) {
                errors.add(reject(EntityKind.SERIES, record.name(), "has no authors"));
                continue;
            }
            if (isValid(EntityKind.SERIES, record.name(), record, errors)) {
                try {
                    Series series = SeriesMapper.toEntity(record);
                    series.getAuthors().addAll(References.resolveAll(authorRepository, record.authorIds(),
                        EntityKind.AUTHOR, Author::getId));
                    seriesRepository.save(series);
                    insertedOwners.add(series.getId());
                    imported.merge(EntityKind.SERIES, 1, Integer::sum);
                } catch (ResourceNotFoundException ex) {
                    errors.add(reject(EntityKind.SERIES, record.name(), ex.getMessage()));
                }
            }
        }

        for (CreateBookRequest record : nullSafe(batch.books())) {
            if (record.id() != null && bookRepository.existsById(record.id())) {
                continue;
            }
            if (isValid(EntityKind.BOOK, record.title(), record, errors)) {
                try {
                    bookRepository.save(toBook(record));
                    imported.merge(EntityKind.BOOK, 1, Integer::sum);
                } catch (ResourceNotFoundException ex) {
                    errors.add(reject(EntityKind.BOOK, record.title(), ex.getMessage()));
                }
            }
        }

        int rejected = errors.size();

        CleanupResult cleanup = orphanCleanupService.cleanupOrphans();
        cleanup.deletedAuthors().forEach(a -> errors.add(cleanupNote(EntityKind.AUTHOR, a)));
        cleanup.deletedPublishers().forEach(p -> errors.add(cleanupNote(EntityKind.PUBLISHER, p)));
        cleanup.deletedSeries().forEach(s -> errors.add(cleanupNote(EntityKind.SERIES, s)));
        withdraw(imported, EntityKind.AUTHOR, cleanup.deletedAuthors(), insertedOwners);
        withdraw(imported, EntityKind.PUBLISHER, cleanup.deletedPublishers(), insertedOwners);
        withdraw(imported, EntityKind.SERIES, cleanup.deletedSeries(), insertedOwners);

        log.info("Imported batch v{}: {} ({} rejected, {} orphan(s) cleaned up)",
            batch.version(), imported, rejected, cleanup.totalDeleted());
        return new ImportResult(rejected == 0, imported, errors);
    }

    @Transactional(readOnly = true)
    public CatalogBatch exportCatalog() {
        Sort byName = Sort.by("name");
        return new CatalogBatch(
            catalogProperties.getExportFormatVersion(),
            Instant.now(),
            categoryRepository.findAll(byName).stream().map(TaxonomyMapper::toRecord).toList(),
            authorRepository.findAll(byName).stream().map(AuthorMapper::toRecord).toList(),
            publisherRepository.findAll(byName).stream().map(PublisherMapper::toRecord).toList(),
            genreRepository.findAll(byName).stream().map(TaxonomyMapper::toRecord).toList(),
            topicRepository.findAll(byName).stream().map(TaxonomyMapper::toRecord).toList(),
            seriesRepository.findAll(byName).stream().map(SeriesMapper::toRecord).toList(),
            bookRepository.findAll(Sort.by("title")).stream().map(BookMapper::toRecord).toList()
        );
    }

    private Book toBook(CreateBookRequest record) {
        Book book = BookMapper.toEntity(record);
        book.setPublisher(publisherRepository.findById(record.publisherId())
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.PUBLISHER, record.publisherId())));
        book.setCategory(categoryRepository.findById(record.categoryId())
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.CATEGORY, record.categoryId())));
        if (record.seriesId() != null) {
            book.setSeries(seriesRepository.findById(record.seriesId())
                .orElseThrow(() -> new ResourceNotFoundException(EntityKind.SERIES, record.seriesId())));
        }
        book.getAuthors().addAll(References.resolveAll(authorRepository, record.authorIds(),
            EntityKind.AUTHOR, Author::getId));
        book.getGenres().addAll(References.resolveAll(genreRepository, record.genreIds(),
            EntityKind.GENRE, Genre::getId));
        book.getTopics().addAll(References.resolveAll(topicRepository, record.topicIds(),
            EntityKind.TOPIC, Topic::getId));
        return book;
    }

    private <T> boolean isValid(EntityKind kind, String label, T record, List<String> errors) {
        Set<ConstraintViolation<T>> violations = validator.validate(record);
        if (violations.isEmpty()) {
            return true;
        }
        String detail = violations.stream()
            .map(ConstraintViolation::getMessage)
            .sorted()
            .collect(Collectors.joining("; "));
        errors.add(reject(kind, label, detail));
        return false;
    }

    private static String reject(EntityKind kind, String label, String reason) {
        return kind.displayName() + " '" + (label != null ? label : "<unnamed>") + "' skipped: " + reason;
    }

    /** Records inserted and then removed again as orphans do not count as imported. */
    private static void withdraw(Map<EntityKind, Integer> imported, EntityKind kind,
                                 List<EntityRef> removed, Set<UUID> insertedOwners) {
        long withdrawn = removed.stream()
            .filter(ref -> insertedOwners.contains(ref.id()))
            .count();
        imported.merge(kind, (int) -withdrawn, Integer::sum);
    }

    private static String cleanupNote(EntityKind kind, EntityRef ref) {
        return "Removed orphan " + kind.displayName().toLowerCase() + " '" + ref.name() + "' after import";
    }

    private static <T> List<T> nullSafe(List<T> records) {
        return records != null ? records : List.of();
    }
}
