package com.homelibrary.catalog.mapper;

import com.homelibrary.catalog.dto.request.CreateAuthorRequest;
import com.homelibrary.catalog.dto.request.UpdateAuthorRequest;
import com.homelibrary.catalog.dto.response.AuthorResponse;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Book;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

public final class AuthorMapper {

    private AuthorMapper() {}

    public static Author toEntity(CreateAuthorRequest request) {
        Author author = new Author();
        author.setId(request.id() != null ? request.id() : UUID.randomUUID());
        author.setName(request.name());
        author.setBio(request.bio());
        return author;
    }

    public static AuthorResponse toResponse(Author author) {
        List<AuthorResponse.BookSummary> books = author.getBooks().stream()
            .sorted(Comparator.comparing(Book::getTitle))
            .map(book -> new AuthorResponse.BookSummary(book.getId(), book.getTitle()))
            .toList();
        List<EntityRef> series = author.getSeries().stream()
            .map(s -> new EntityRef(s.getId(), s.getName()))
            .sorted(Comparator.comparing(EntityRef::name))
            .toList();

        return new AuthorResponse(
            author.getId(),
            author.getName(),
            author.getBio(),
            books,
            series,
            author.getCreatedAt(),
            author.getUpdatedAt()
        );
    }

    public static EntityRef toRef(Author author) {
        return new EntityRef(author.getId(), author.getName());
    }

    public static CreateAuthorRequest toRecord(Author author) {
        return new CreateAuthorRequest(author.getId(), author.getName(), author.getBio());
    }

    public static void updateEntity(Author author, UpdateAuthorRequest request) {
        if (request.name() != null) {
            author.setName(request.name());
        }
        if (request.bio() != null) {
            author.setBio(request.bio());
        }
    }
}
