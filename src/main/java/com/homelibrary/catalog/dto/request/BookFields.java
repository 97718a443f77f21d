package com.homelibrary.catalog.dto.request;

import com.homelibrary.catalog.entity.ReadingStatus;

import java.util.List;
import java.util.UUID;

/**
 * The full writable state of a book, shared by create, update and update-impact requests.
 * Link lists replace the current links; {@code null} is treated as empty.
 */
public interface BookFields {

    String title();

    String isbn();

    Integer publicationYear();

    Integer pages();

    String description();

    String coverImage();

    ReadingStatus readingStatus();

    String notes();

    Double rating();

    UUID publisherId();

    UUID categoryId();

    UUID seriesId();

    Integer seriesOrder();

    List<UUID> authorIds();

    List<UUID> genreIds();

    List<UUID> topicIds();
}
