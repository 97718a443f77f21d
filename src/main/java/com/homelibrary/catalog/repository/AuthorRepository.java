package com.homelibrary.catalog.repository;

import com.homelibrary.catalog.entity.Author;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AuthorRepository extends JpaRepository<Author, UUID> {

    @Query("SELECT a FROM Author a LEFT JOIN FETCH a.books WHERE a.id = :id")
    Optional<Author> findByIdWithBooks(@Param("id") UUID id);

    @Query("SELECT COUNT(b) FROM Book b JOIN b.authors a WHERE a.id = :authorId")
    long countBooksByAuthorId(@Param("authorId") UUID authorId);

    @Query("SELECT a FROM Author a WHERE a.books IS EMPTY")
    List<Author> findOrphans();

    @Query("""
        SELECT a.name, COUNT(b) FROM Author a JOIN a.books b
        GROUP BY a.id, a.name
        ORDER BY COUNT(b) DESC, a.name ASC
        """)
    List<Object[]> findTopByBookCount(Pageable pageable);
}
