package com.homelibrary.catalog.integration;

import com.homelibrary.catalog.dto.request.CreateBookRequest;
import com.homelibrary.catalog.dto.request.ReadingProgressRequest;
import com.homelibrary.catalog.dto.request.UpdateBookRequest;
import com.homelibrary.catalog.dto.response.BookResponse;
import com.homelibrary.catalog.dto.response.DeleteResult;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.dto.response.ErrorResponse;
import com.homelibrary.catalog.dto.response.PagedResponse;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.ReadingStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class BookIntegrationTest extends AbstractIntegrationTest {

    @Test
    void fullCrudLifecycle() {
        UUID authorId = createAuthor("Joshua Bloch");
        UUID publisherId = createPublisher("Addison-Wesley");

        // CREATE
        var createRequest = new CreateBookRequest(null, "Effective Java", "9780134685991", 2018, 412,
            "Best practices", null, null, null, 4.5, publisherId, DEFAULT_CATEGORY_ID, null, null,
            List.of(authorId), List.of(FICTION_GENRE_ID), List.of());
        ResponseEntity<BookResponse> createResponse =
            restTemplate.postForEntity(BOOKS_URL, createRequest, BookResponse.class);

        assertThat(createResponse.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        BookResponse created = createResponse.getBody();
        assertThat(created).isNotNull();
        assertThat(created.id()).isNotNull();
        assertThat(created.readingStatus()).isEqualTo(ReadingStatus.UNREAD);
        assertThat(created.publisher().name()).isEqualTo("Addison-Wesley");
        assertThat(created.authors()).extracting(EntityRef::name).containsExactly("Joshua Bloch");
        assertThat(created.genres()).extracting(EntityRef::name).containsExactly("Fiction");

        UUID bookId = created.id();

        // GET by ID
        ResponseEntity<BookResponse> getResponse =
            restTemplate.getForEntity(BOOKS_URL + "/" + bookId, BookResponse.class);
        assertThat(getResponse.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(getResponse.getBody().title()).isEqualTo("Effective Java");

        // UPDATE, adding a co-author so nobody is orphaned
        UUID coAuthorId = createAuthor("Brian Goetz");
        var updateRequest = new UpdateBookRequest("Effective Java 3rd Ed", "9780134685991", 2018, 412,
            null, null, ReadingStatus.READING, null, null, publisherId, DEFAULT_CATEGORY_ID, null, null,
            List.of(authorId, coAuthorId), List.of(), List.of());
        ResponseEntity<BookResponse> updateResponse = restTemplate.exchange(
            BOOKS_URL + "/" + bookId, HttpMethod.PUT, new HttpEntity<>(updateRequest), BookResponse.class);

        assertThat(updateResponse.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(updateResponse.getBody().title()).isEqualTo("Effective Java 3rd Ed");
        assertThat(updateResponse.getBody().authors()).hasSize(2);
        assertThat(updateResponse.getBody().genres()).isEmpty();

        // DELETE with cascade removes the book and its now bookless records
        ResponseEntity<DeleteResult> deleteResponse = restTemplate.exchange(
            BOOKS_URL + "/" + bookId + "?cascadeOrphans=true", HttpMethod.DELETE, null, DeleteResult.class);

        assertThat(deleteResponse.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(deleteResponse.getBody().deletedEntities())
            .extracting(DeleteResult.DeletedEntity::kind)
            .containsExactly(EntityKind.BOOK, EntityKind.AUTHOR, EntityKind.AUTHOR, EntityKind.PUBLISHER);

        ResponseEntity<ErrorResponse> getAfterDelete =
            restTemplate.getForEntity(BOOKS_URL + "/" + bookId, ErrorResponse.class);
        assertThat(getAfterDelete.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void createBook_withNonExistentAuthor_returns404() {
        UUID publisherId = createPublisher("Penguin");
        var request = bookRequest("Ghost", publisherId, null, List.of(UUID.randomUUID()));

        ResponseEntity<ErrorResponse> response =
            restTemplate.postForEntity(BOOKS_URL, request, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().message()).contains("Author");
    }

    @Test
    void createBook_withoutPublisher_returns400() {
        var request = bookRequest("", null, null, List.of());

        ResponseEntity<ErrorResponse> response =
            restTemplate.postForEntity(BOOKS_URL, request, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().fieldErrors())
            .extracting(ErrorResponse.FieldError::field)
            .contains("title", "publisherId");
    }

    @Test
    void createBook_withExistingId_returns409() {
        UUID publisherId = createPublisher("Penguin");
        UUID bookId = createBook("Dune", publisherId, null);
        var request = new CreateBookRequest(bookId, "Dune Again", null, null, null, null, null, null, null,
            null, publisherId, DEFAULT_CATEGORY_ID, null, null, List.of(), List.of(), List.of());

        ResponseEntity<ErrorResponse> response =
            restTemplate.postForEntity(BOOKS_URL, request, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void updateProgress_changesOnlyStatusAndNotes() {
        UUID publisherId = createPublisher("Penguin");
        UUID bookId = createBook("Dune", publisherId, null);

        ResponseEntity<BookResponse> response = restTemplate.exchange(
            BOOKS_URL + "/" + bookId + "/progress", HttpMethod.PUT,
            new HttpEntity<>(new ReadingProgressRequest(ReadingStatus.COMPLETED, "Loved it")), BookResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().readingStatus()).isEqualTo(ReadingStatus.COMPLETED);
        assertThat(response.getBody().notes()).isEqualTo("Loved it");
        assertThat(response.getBody().publisher().id()).isEqualTo(publisherId);
    }

    @Test
    void findAll_returnsPaginatedBooks() {
        UUID publisherId = createPublisher("Penguin");
        createBook("Book 1", publisherId, null);
        createBook("Book 2", publisherId, null);

        ResponseEntity<PagedResponse> response = restTemplate.getForEntity(
            BOOKS_URL + "?page=0&size=10", PagedResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().totalElements()).isEqualTo(2);
    }

    @Test
    void getBook_nonExistent_returns404() {
        ResponseEntity<ErrorResponse> response =
            restTemplate.getForEntity(BOOKS_URL + "/" + UUID.randomUUID(), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void getBook_malformedId_returns400() {
        ResponseEntity<ErrorResponse> response =
            restTemplate.getForEntity(BOOKS_URL + "/not-a-uuid", ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
