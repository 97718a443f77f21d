package com.homelibrary.catalog.repository;

import com.homelibrary.catalog.entity.Book;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface BookRepository extends JpaRepository<Book, UUID> {

    @Query("""
        SELECT b FROM Book b
        JOIN FETCH b.publisher
        JOIN FETCH b.category
        LEFT JOIN FETCH b.series
        LEFT JOIN FETCH b.authors
        WHERE b.id = :id
        """)
    Optional<Book> findByIdWithRelations(@Param("id") UUID id);

    long countByPublisherId(UUID publisherId);

    long countBySeriesId(UUID seriesId);

    long countByCategoryId(UUID categoryId);

    @Query("SELECT b.readingStatus, COUNT(b) FROM Book b GROUP BY b.readingStatus")
    List<Object[]> countByReadingStatus();

    /** Books whose publisher FK does not resolve. The FK constraint makes this a defensive scan. */
    @Query(value = """
        SELECT b.id AS id, b.title AS name FROM books b
        LEFT JOIN publishers p ON b.publisher_id = p.id
        WHERE p.id IS NULL
        """, nativeQuery = true)
    List<EntityReference> findWithoutPublisher();

    @Query(value = """
        SELECT b.id AS id, b.title AS name FROM books b
        LEFT JOIN categories c ON b.category_id = c.id
        WHERE c.id IS NULL
        """, nativeQuery = true)
    List<EntityReference> findWithoutCategory();
}
