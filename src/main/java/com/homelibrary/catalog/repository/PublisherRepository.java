package com.homelibrary.catalog.repository;

import com.homelibrary.catalog.entity.Publisher;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.UUID;

public interface PublisherRepository extends JpaRepository<Publisher, UUID> {

    @Query("SELECT p FROM Publisher p WHERE NOT EXISTS (SELECT b FROM Book b WHERE b.publisher = p)")
    List<Publisher> findOrphans();
}
