package com.homelibrary.catalog.mapper;

import com.homelibrary.catalog.dto.request.CategoryRequest;
import com.homelibrary.catalog.dto.request.TagRequest;
import com.homelibrary.catalog.dto.response.CategoryResponse;
import com.homelibrary.catalog.dto.response.TagResponse;
import com.homelibrary.catalog.entity.Category;
import com.homelibrary.catalog.entity.Genre;
import com.homelibrary.catalog.entity.Topic;

import java.util.UUID;

/**
 * Categories, genres and topics: free-form labels without cardinality rules.
 */
public final class TaxonomyMapper {

    private TaxonomyMapper() {}

    public static Category toCategory(CategoryRequest request) {
        Category category = new Category();
        category.setId(request.id() != null ? request.id() : UUID.randomUUID());
        updateCategory(category, request);
        return category;
    }

    public static void updateCategory(Category category, CategoryRequest request) {
        category.setName(request.name());
        category.setDescription(request.description());
        category.setColor(request.color() != null ? request.color() : Category.DEFAULT_COLOR);
    }

    public static CategoryResponse toResponse(Category category, long bookCount) {
        return new CategoryResponse(
            category.getId(),
            category.getName(),
            category.getDescription(),
            category.getColor(),
            bookCount,
            category.getCreatedAt(),
            category.getUpdatedAt()
        );
    }

    public static CategoryRequest toRecord(Category category) {
        return new CategoryRequest(category.getId(), category.getName(),
            category.getDescription(), category.getColor());
    }

    public static Genre toGenre(TagRequest request) {
        Genre genre = new Genre();
        genre.setId(request.id() != null ? request.id() : UUID.randomUUID());
        genre.setName(request.name());
        genre.setDescription(request.description());
        return genre;
    }

    public static Topic toTopic(TagRequest request) {
        Topic topic = new Topic();
        topic.setId(request.id() != null ? request.id() : UUID.randomUUID());
        topic.setName(request.name());
        topic.setDescription(request.description());
        return topic;
    }

    public static TagResponse toResponse(Genre genre) {
        return new TagResponse(genre.getId(), genre.getName(), genre.getDescription(),
            genre.getCreatedAt(), genre.getUpdatedAt());
    }

    public static TagResponse toResponse(Topic topic) {
        return new TagResponse(topic.getId(), topic.getName(), topic.getDescription(),
            topic.getCreatedAt(), topic.getUpdatedAt());
    }

    public static TagRequest toRecord(Genre genre) {
        return new TagRequest(genre.getId(), genre.getName(), genre.getDescription());
    }

    public static TagRequest toRecord(Topic topic) {
        return new TagRequest(topic.getId(), topic.getName(), topic.getDescription());
    }
}
