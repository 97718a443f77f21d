package com.homelibrary.catalog.repository;

import com.homelibrary.catalog.entity.Series;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SeriesRepository extends JpaRepository<Series, UUID> {

    @Query("SELECT s FROM Series s LEFT JOIN FETCH s.authors WHERE s.id = :id")
    Optional<Series> findByIdWithAuthors(@Param("id") UUID id);

    /** Series in which the given author is currently the only linked author. */
    @Query("""
        SELECT s FROM Series s JOIN s.authors a
        WHERE a.id = :authorId AND SIZE(s.authors) = 1
        """)
    List<Series> findWhereSoleAuthor(@Param("authorId") UUID authorId);

    @Query("SELECT s FROM Series s WHERE NOT EXISTS (SELECT b FROM Book b WHERE b.series = s)")
    List<Series> findOrphans();

    @Query("SELECT s FROM Series s WHERE s.authors IS EMPTY")
    List<Series> findWithoutAuthors();
}
