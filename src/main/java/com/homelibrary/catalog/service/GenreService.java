package com.homelibrary.catalog.service;

import com.homelibrary.catalog.dto.request.TagRequest;
import com.homelibrary.catalog.dto.response.TagResponse;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.Genre;
import com.homelibrary.catalog.exception.DuplicateResourceException;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.mapper.TaxonomyMapper;
import com.homelibrary.catalog.repository.GenreRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class GenreService {

    private static final Logger log = LoggerFactory.getLogger(GenreService.class);

    private final GenreRepository genreRepository;

    @Transactional(readOnly = true)
    public Page<TagResponse> findAll(Pageable pageable) {
        return genreRepository.findAll(pageable)
            .map(TaxonomyMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public TagResponse findById(UUID id) {
        return TaxonomyMapper.toResponse(load(id));
    }

    @Transactional
    public TagResponse create(TagRequest request) {
        if (request.id() != null && genreRepository.existsById(request.id())) {
            throw new DuplicateResourceException(EntityKind.GENRE, "id", request.id());
        }
        if (genreRepository.existsByNameIgnoreCase(request.name())) {
            throw new DuplicateResourceException(EntityKind.GENRE, "name", request.name());
        }
        Genre saved = genreRepository.save(TaxonomyMapper.toGenre(request));
        return TaxonomyMapper.toResponse(saved);
    }

    @Transactional
    public TagResponse update(UUID id, TagRequest request) {
        Genre genre = load(id);
        if (genreRepository.existsByNameIgnoreCaseAndIdNot(request.name(), id)) {
            throw new DuplicateResourceException(EntityKind.GENRE, "name", request.name());
        }
        genre.setName(request.name());
        genre.setDescription(request.description());
        return TaxonomyMapper.toResponse(genreRepository.save(genre));
    }

    /** Genres carry no minimum cardinality; their book links are dropped first. */
    @Transactional
    public void delete(UUID id) {
        Genre genre = load(id);
        int unlinked = genreRepository.deleteBookLinks(id);
        genreRepository.delete(genre);
        log.info("Deleted genre {} ({}), unlinked from {} book(s)", genre.getName(), id, unlinked);
    }

    private Genre load(UUID id) {
        return genreRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.GENRE, id));
    }
}
