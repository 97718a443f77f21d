package com.homelibrary.catalog.repository;

import com.homelibrary.catalog.entity.Genre;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface GenreRepository extends JpaRepository<Genre, UUID> {

    boolean existsByNameIgnoreCase(String name);

    boolean existsByNameIgnoreCaseAndIdNot(String name, UUID id);

    @Modifying
    @Query(value = "DELETE FROM book_genres WHERE genre_id = :genreId", nativeQuery = true)
    int deleteBookLinks(@Param("genreId") UUID genreId);

    @Query("""
        SELECT g.name, COUNT(b) FROM Book b JOIN b.genres g
        GROUP BY g.id, g.name
        ORDER BY COUNT(b) DESC, g.name ASC
        """)
    List<Object[]> findTopByBookCount(Pageable pageable);
}
