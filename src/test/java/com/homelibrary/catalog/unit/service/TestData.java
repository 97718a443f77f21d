package com.homelibrary.catalog.unit.service;

import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Book;
import com.homelibrary.catalog.entity.Category;
import com.homelibrary.catalog.entity.Publisher;
import com.homelibrary.catalog.entity.Series;

import java.util.UUID;

/**
 * Detached entities for service tests. Ids are set directly since nothing is persisted.
 */
final class TestData {

    private TestData() {}

    static Author author(String name) {
        Author author = new Author();
        author.setId(UUID.randomUUID());
        author.setName(name);
        return author;
    }

    static Publisher publisher(String name) {
        Publisher publisher = new Publisher();
        publisher.setId(UUID.randomUUID());
        publisher.setName(name);
        return publisher;
    }

    static Category category(String name) {
        Category category = new Category();
        category.setId(UUID.randomUUID());
        category.setName(name);
        return category;
    }

    static Series series(String name, Author... authors) {
        Series series = new Series();
        series.setId(UUID.randomUUID());
        series.setName(name);
        for (Author author : authors) {
            series.getAuthors().add(author);
            author.getSeries().add(series);
        }
        return series;
    }

    static Book book(String title, Publisher publisher, Category category, Author... authors) {
        Book book = new Book();
        book.setId(UUID.randomUUID());
        book.setTitle(title);
        book.setPublisher(publisher);
        book.setCategory(category);
        for (Author author : authors) {
            book.getAuthors().add(author);
            author.getBooks().add(book);
        }
        return book;
    }
}
