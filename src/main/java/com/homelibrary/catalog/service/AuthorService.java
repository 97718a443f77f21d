package com.homelibrary.catalog.service;

import com.homelibrary.catalog.dto.request.CreateAuthorRequest;
import com.homelibrary.catalog.dto.request.UpdateAuthorRequest;
import com.homelibrary.catalog.dto.response.AuthorResponse;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.Series;
import com.homelibrary.catalog.exception.BlockedByInvariantException;
import com.homelibrary.catalog.exception.DuplicateResourceException;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.mapper.AuthorMapper;
import com.homelibrary.catalog.repository.AuthorRepository;
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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AuthorService {

    private static final Logger log = LoggerFactory.getLogger(AuthorService.class);

    private final AuthorRepository authorRepository;
    private final SeriesRepository seriesRepository;
    private final OrphanCleanupService orphanCleanupService;

    @Transactional(readOnly = true)
    public Page<AuthorResponse> findAll(Pageable pageable) {
        return authorRepository.findAll(pageable)
            .map(AuthorMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public AuthorResponse findById(UUID id) {
        Author author = authorRepository.findByIdWithBooks(id)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.AUTHOR, id));
        return AuthorMapper.toResponse(author);
    }

    /** Standalone authors start as orphans until a book links them. */
    @Transactional
    public AuthorResponse create(CreateAuthorRequest request) {
        if (request.id() != null && authorRepository.existsById(request.id())) {
            throw new DuplicateResourceException(EntityKind.AUTHOR, "id", request.id());
        }
        Author saved = authorRepository.save(AuthorMapper.toEntity(request));
        return AuthorMapper.toResponse(saved);
    }

    @Transactional
    public AuthorResponse update(UUID id, UpdateAuthorRequest request) {
        Author author = authorRepository.findByIdWithBooks(id)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.AUTHOR, id));
        AuthorMapper.updateEntity(author, request);
        Author saved = authorRepository.save(author);
        return AuthorMapper.toResponse(saved);
    }

    /**
     * Deletes an author that no book references and that is not the only author of any
     * series. Never cascades.
     */
    @Transactional
    public void delete(UUID id) {
        Author author = authorRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.AUTHOR, id));

        List<InvariantViolation> violations = new ArrayList<>();
        long bookCount = authorRepository.countBooksByAuthorId(id);
        if (bookCount > 0) {
            violations.add(InvariantViolation.withCount(ViolationType.AUTHOR_HAS_BOOKS, EntityKind.AUTHOR,
                id, author.getName(), "is still linked to " + bookCount + " book(s)", bookCount));
        }
        for (Series series : seriesRepository.findWhereSoleAuthor(id)) {
            violations.add(InvariantViolation.of(ViolationType.SOLE_SERIES_AUTHOR, EntityKind.SERIES,
                series.getId(), series.getName(), "has \"" + author.getName() + "\" as its only author"));
        }
        if (!violations.isEmpty()) {
            log.warn("Refused to delete author {} ({}): {} violation(s)", author.getName(), id, violations.size());
            throw new BlockedByInvariantException(
                "Cannot delete author \"" + author.getName() + "\"", violations);
        }

        orphanCleanupService.removeAuthor(author);
        log.info("Deleted author {} ({})", author.getName(), id);
    }
}
