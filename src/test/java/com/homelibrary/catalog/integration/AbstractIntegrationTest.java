package com.homelibrary.catalog.integration;

import com.homelibrary.catalog.dto.request.CreateAuthorRequest;
import com.homelibrary.catalog.dto.request.CreateBookRequest;
import com.homelibrary.catalog.dto.request.PublisherRequest;
import com.homelibrary.catalog.dto.request.SeriesRequest;
import com.homelibrary.catalog.dto.response.AuthorResponse;
import com.homelibrary.catalog.dto.response.BookResponse;
import com.homelibrary.catalog.dto.response.PublisherResponse;
import com.homelibrary.catalog.dto.response.SeriesResponse;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full application on a random port against in-memory H2 (PostgreSQL mode),
 * migrated by Flyway. Every test starts from the seeded catalog: the default category
 * and the ten default genres.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
public abstract class AbstractIntegrationTest {

    protected static final UUID DEFAULT_CATEGORY_ID = UUID.fromString("00000000-0000-4000-8000-000000000001");
    protected static final UUID FICTION_GENRE_ID = UUID.fromString("00000000-0000-4000-8000-000000000010");

    protected static final String BOOKS_URL = "/api/v1/books";
    protected static final String AUTHORS_URL = "/api/v1/authors";
    protected static final String PUBLISHERS_URL = "/api/v1/publishers";
    protected static final String SERIES_URL = "/api/v1/series";

    @Autowired
    protected TestRestTemplate restTemplate;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetCatalog() {
        jdbcTemplate.update("DELETE FROM book_authors");
        jdbcTemplate.update("DELETE FROM book_genres");
        jdbcTemplate.update("DELETE FROM book_topics");
        jdbcTemplate.update("DELETE FROM series_authors");
        jdbcTemplate.update("DELETE FROM books");
        jdbcTemplate.update("DELETE FROM series");
        jdbcTemplate.update("DELETE FROM authors");
        jdbcTemplate.update("DELETE FROM publishers");
        jdbcTemplate.update("DELETE FROM topics");
        jdbcTemplate.update("DELETE FROM genres WHERE CAST(id AS VARCHAR(36)) NOT LIKE '00000000-0000-4000-8000-00000000001_'");
        jdbcTemplate.update("DELETE FROM categories WHERE id <> ?", DEFAULT_CATEGORY_ID);
    }

    protected UUID createAuthor(String name) {
        ResponseEntity<AuthorResponse> response = restTemplate.postForEntity(AUTHORS_URL,
            new CreateAuthorRequest(null, name, null), AuthorResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }

    protected UUID createPublisher(String name) {
        ResponseEntity<PublisherResponse> response = restTemplate.postForEntity(PUBLISHERS_URL,
            new PublisherRequest(null, name, null, null), PublisherResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }

    protected UUID createSeries(String name, UUID... authorIds) {
        ResponseEntity<SeriesResponse> response = restTemplate.postForEntity(SERIES_URL,
            new SeriesRequest(null, name, null, List.of(authorIds)), SeriesResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }

    protected UUID createBook(String title, UUID publisherId, UUID seriesId, UUID... authorIds) {
        ResponseEntity<BookResponse> response = restTemplate.postForEntity(BOOKS_URL,
            bookRequest(title, publisherId, seriesId, List.of(authorIds)), BookResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }

    protected static CreateBookRequest bookRequest(String title, UUID publisherId, UUID seriesId,
                                                   List<UUID> authorIds) {
        return new CreateBookRequest(null, title, null, null, null, null, null, null, null, null,
            publisherId, DEFAULT_CATEGORY_ID, seriesId, seriesId != null ? 1 : null,
            authorIds, List.of(), List.of());
    }

    protected boolean exists(String table, UUID id) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }
}
