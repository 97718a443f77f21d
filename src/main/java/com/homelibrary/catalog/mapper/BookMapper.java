package com.homelibrary.catalog.mapper;

import com.homelibrary.catalog.dto.request.BookFields;
import com.homelibrary.catalog.dto.request.CreateBookRequest;
import com.homelibrary.catalog.dto.response.BookResponse;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Book;
import com.homelibrary.catalog.entity.Genre;
import com.homelibrary.catalog.entity.ReadingStatus;
import com.homelibrary.catalog.entity.Topic;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Scalar fields only. References (publisher, category, series, link sets) are resolved
 * by {@code BookService}, which needs the repositories to do so.
 */
public final class BookMapper {

    private BookMapper() {}

    public static Book toEntity(CreateBookRequest request) {
        Book book = new Book();
        book.setId(request.id() != null ? request.id() : UUID.randomUUID());
        updateEntity(book, request);
        return book;
    }

    public static void updateEntity(Book book, BookFields fields) {
        book.setTitle(fields.title());
        book.setIsbn(fields.isbn());
        book.setPublicationYear(fields.publicationYear());
        book.setPages(fields.pages());
        book.setDescription(fields.description());
        book.setCoverImage(fields.coverImage());
        book.setReadingStatus(fields.readingStatus() != null ? fields.readingStatus() : ReadingStatus.UNREAD);
        book.setNotes(fields.notes());
        book.setRating(fields.rating());
        book.setSeriesOrder(fields.seriesId() != null ? fields.seriesOrder() : null);
    }

    public static BookResponse toResponse(Book book) {
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getIsbn(),
            book.getPublicationYear(),
            book.getPages(),
            book.getDescription(),
            book.getCoverImage(),
            book.getReadingStatus(),
            book.getNotes(),
            book.getRating(),
            new EntityRef(book.getPublisher().getId(), book.getPublisher().getName()),
            new EntityRef(book.getCategory().getId(), book.getCategory().getName()),
            book.getSeries() != null
                ? new EntityRef(book.getSeries().getId(), book.getSeries().getName())
                : null,
            book.getSeriesOrder(),
            sorted(book.getAuthors().stream().map(AuthorMapper::toRef).toList()),
            sorted(book.getGenres().stream().map(g -> new EntityRef(g.getId(), g.getName())).toList()),
            sorted(book.getTopics().stream().map(t -> new EntityRef(t.getId(), t.getName())).toList()),
            book.getVersion(),
            book.getCreatedAt(),
            book.getUpdatedAt()
        );
    }

    public static CreateBookRequest toRecord(Book book) {
        return new CreateBookRequest(
            book.getId(),
            book.getTitle(),
            book.getIsbn(),
            book.getPublicationYear(),
            book.getPages(),
            book.getDescription(),
            book.getCoverImage(),
            book.getReadingStatus(),
            book.getNotes(),
            book.getRating(),
            book.getPublisher().getId(),
            book.getCategory().getId(),
            book.getSeries() != null ? book.getSeries().getId() : null,
            book.getSeriesOrder(),
            book.getAuthors().stream().map(Author::getId).sorted().toList(),
            book.getGenres().stream().map(Genre::getId).sorted().toList(),
            book.getTopics().stream().map(Topic::getId).sorted().toList()
        );
    }

    private static List<EntityRef> sorted(List<EntityRef> refs) {
        return refs.stream().sorted(Comparator.comparing(EntityRef::name)).toList();
    }
}
