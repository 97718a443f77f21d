package com.homelibrary.catalog.service;

import com.homelibrary.catalog.dto.request.TagRequest;
import com.homelibrary.catalog.dto.response.TagResponse;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.Topic;
import com.homelibrary.catalog.exception.DuplicateResourceException;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.mapper.TaxonomyMapper;
import com.homelibrary.catalog.repository.TopicRepository;
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
public class TopicService {

    private static final Logger log = LoggerFactory.getLogger(TopicService.class);

    private final TopicRepository topicRepository;

    @Transactional(readOnly = true)
    public Page<TagResponse> findAll(Pageable pageable) {
        return topicRepository.findAll(pageable)
            .map(TaxonomyMapper::toResponse);
    }

    @Transactional(readOnly = true)
    public TagResponse findById(UUID id) {
        return TaxonomyMapper.toResponse(load(id));
    }

    @Transactional
    public TagResponse create(TagRequest request) {
        if (request.id() != null && topicRepository.existsById(request.id())) {
            throw new DuplicateResourceException(EntityKind.TOPIC, "id", request.id());
        }
        if (topicRepository.existsByNameIgnoreCase(request.name())) {
            throw new DuplicateResourceException(EntityKind.TOPIC, "name", request.name());
        }
        Topic saved = topicRepository.save(TaxonomyMapper.toTopic(request));
        return TaxonomyMapper.toResponse(saved);
    }

    @Transactional
    public TagResponse update(UUID id, TagRequest request) {
        Topic topic = load(id);
        if (topicRepository.existsByNameIgnoreCaseAndIdNot(request.name(), id)) {
            throw new DuplicateResourceException(EntityKind.TOPIC, "name", request.name());
        }
        topic.setName(request.name());
        topic.setDescription(request.description());
        return TaxonomyMapper.toResponse(topicRepository.save(topic));
    }

    /** Removing a topic only drops its book links. */
    @Transactional
    public void delete(UUID id) {
        Topic topic = load(id);
        int unlinked = topicRepository.deleteBookLinks(id);
        topicRepository.delete(topic);
        log.info("Deleted topic {} ({}), unlinked from {} book(s)", topic.getName(), id, unlinked);
    }

    private Topic load(UUID id) {
        return topicRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException(EntityKind.TOPIC, id));
    }
}
