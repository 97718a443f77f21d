package com.homelibrary.catalog.service;

import com.homelibrary.catalog.dto.request.PublisherRequest;
import com.homelibrary.catalog.dto.response.PublisherResponse;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.Publisher;
import com.homelibrary.catalog.exception.BlockedByInvariantException;
import com.homelibrary.catalog.exception.DuplicateResourceException;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.mapper.PublisherMapper;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.PublisherRepository;
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
public class PublisherService {

    private static final Logger log = LoggerFactory.getLogger(PublisherService.class);

    private final PublisherRepository publisherRepository;
    private final BookRepository bookRepository;
    private final OrphanCleanupService orphanCleanupService;

    @Transactional(readOnly = true)
    public Page<PublisherResponse> findAll(Pageable pageable) {
        return publisherRepository.findAll(pageable)
            .map(this::toResponse);
    }

    @Transactional(readOnly = true)
    public PublisherResponse findById(UUID id) {
        return toResponse(load(id));
    }

    @Transactional
    public PublisherResponse create(PublisherRequest request) {
        if (request.id() != null && publisherRepository.existsById(request.id())) {
            throw new DuplicateResourceException(EntityKind.PUBLISHER, "id", request.id());
        }
        Publisher saved = publisherRepository.save(PublisherMapper.toEntity(request));
        return PublisherMapper.toResponse(saved, 0);
    }

    @Transactional
    public PublisherResponse update(UUID id, PublisherRequest request) {
        Publisher publisher = load(id);
        PublisherMapper.updateEntity(publisher, request);
        return toResponse(publisherRepository.save(publisher));
    }

    @Transactional
    public void delete(UUID id) {
        Publisher publisher = load(id);
        long bookCount = bookRepository.countByPublisherId(id);
        if (bookCount > 0) {
            log.warn("Refused to delete publisher {} ({}): {} book(s) linked", publisher.getName(), id, bookCount);
            throw new BlockedByInvariantException("Cannot delete publisher \"" + publisher.getName() + "\"",
                List.of(InvariantViolation.withCount(ViolationType.PUBLISHER_HAS_BOOKS, EntityKind.PUBLISHER,
                    id, publisher.getName(), "is still linked to " + bookCount + " book(s)", bookCount)));
        }
        orphanCleanupService.removePublisher(publisher);
        log.info("Deleted publisher {} ({})", publisher.getName(), id);
    }

    private Publisher load(UUID id) {
        return publisherRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.PUBLISHER, id));
    }

    private PublisherResponse toResponse(Publisher publisher) {
        return PublisherMapper.toResponse(publisher, bookRepository.countByPublisherId(publisher.getId()));
    }
}
