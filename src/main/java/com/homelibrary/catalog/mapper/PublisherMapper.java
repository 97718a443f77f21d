package com.homelibrary.catalog.mapper;

import com.homelibrary.catalog.dto.request.PublisherRequest;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.dto.response.PublisherResponse;
import com.homelibrary.catalog.entity.Publisher;

import java.util.UUID;

public final class PublisherMapper {

    private PublisherMapper() {}

    public static Publisher toEntity(PublisherRequest request) {
        Publisher publisher = new Publisher();
        publisher.setId(request.id() != null ? request.id() : UUID.randomUUID());
        updateEntity(publisher, request);
        return publisher;
    }

    public static void updateEntity(Publisher publisher, PublisherRequest request) {
        publisher.setName(request.name());
        publisher.setLocation(request.location());
        publisher.setWebsite(request.website());
    }

    public static PublisherResponse toResponse(Publisher publisher, long bookCount) {
        return new PublisherResponse(
            publisher.getId(),
            publisher.getName(),
            publisher.getLocation(),
            publisher.getWebsite(),
            bookCount,
            publisher.getCreatedAt(),
            publisher.getUpdatedAt()
        );
    }

    public static EntityRef toRef(Publisher publisher) {
        return new EntityRef(publisher.getId(), publisher.getName());
    }

    public static PublisherRequest toRecord(Publisher publisher) {
        return new PublisherRequest(publisher.getId(), publisher.getName(),
            publisher.getLocation(), publisher.getWebsite());
    }
}
