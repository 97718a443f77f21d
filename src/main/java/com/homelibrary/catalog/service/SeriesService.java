package com.homelibrary.catalog.service;

import com.homelibrary.catalog.dto.request.SeriesRequest;
import com.homelibrary.catalog.dto.response.SeriesResponse;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.Series;
import com.homelibrary.catalog.exception.BlockedByInvariantException;
import com.homelibrary.catalog.exception.DuplicateResourceException;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.exception.ValidationException;
import com.homelibrary.catalog.mapper.SeriesMapper;
import com.homelibrary.catalog.repository.AuthorRepository;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.SeriesRepository;
import com.homelibrary.catalog.rules.InvariantViolation;
import com.homelibrary.catalog.rules.ViolationType;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class SeriesService {

    private static final Logger log = LoggerFactory.getLogger(SeriesService.class);

    private final SeriesRepository seriesRepository;
    private final AuthorRepository authorRepository;
    private final BookRepository bookRepository;
    private final OrphanCleanupService orphanCleanupService;

    @Transactional(readOnly = true)
    public Page<SeriesResponse> findAll(Pageable pageable) {
        return seriesRepository.findAll(pageable)
            .map(this::toResponse);
    }

    @Transactional(readOnly = true)
    public SeriesResponse findById(UUID id) {
        return toResponse(load(id));
    }

    @Transactional
    public SeriesResponse create(SeriesRequest request) {
        if (request.id() != null && seriesRepository.existsById(request.id())) {
            throw new DuplicateResourceException(EntityKind.SERIES, "id", request.id());
        }
        Series series = SeriesMapper.toEntity(request);
        series.getAuthors().addAll(resolveAuthors(request));
        Series saved = seriesRepository.save(series);
        return SeriesMapper.toResponse(saved, 0);
    }

    /** Replaces name, description and the whole author set. */
    @Transactional
    public SeriesResponse update(UUID id, SeriesRequest request) {
        Series series = load(id);
        List<Author> authors = resolveAuthors(request);
        SeriesMapper.updateEntity(series, request);
        series.getAuthors().retainAll(authors);
        series.getAuthors().addAll(authors);
        return toResponse(seriesRepository.save(series));
    }

    @Transactional
    public void delete(UUID id) {
        Series series = load(id);
        long bookCount = bookRepository.countBySeriesId(id);
        if (bookCount > 0) {
            log.warn("Refused to delete series {} ({}): {} book(s) linked", series.getName(), id, bookCount);
            throw new BlockedByInvariantException("Cannot delete series \"" + series.getName() + "\"",
                List.of(InvariantViolation.withCount(ViolationType.SERIES_HAS_BOOKS, EntityKind.SERIES,
                    id, series.getName(), "still contains " + bookCount + " book(s)", bookCount)));
        }
        orphanCleanupService.removeSeries(series);
        log.info("Deleted series {} ({})", series.getName(), id);
    }

    private List<Author> resolveAuthors(SeriesRequest request) {
        if (request.authorIds() == null || request.authorIds().isEmpty()) {
            throw new ValidationException("A series must have at least one author");
        }
        return References.resolveAll(authorRepository, request.authorIds(), EntityKind.AUTHOR, Author::getId);
    }

    private Series load(UUID id) {
        return seriesRepository.findByIdWithAuthors(id)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.SERIES, id));
    }

    private SeriesResponse toResponse(Series series) {
        return SeriesMapper.toResponse(series, bookRepository.countBySeriesId(series.getId()));
    }
}
