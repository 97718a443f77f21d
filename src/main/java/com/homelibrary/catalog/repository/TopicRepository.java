package com.homelibrary.catalog.repository;

import com.homelibrary.catalog.entity.Topic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface TopicRepository extends JpaRepository<Topic, UUID> {

    boolean existsByNameIgnoreCase(String name);

    boolean existsByNameIgnoreCaseAndIdNot(String name, UUID id);

    @Modifying
    @Query(value = "DELETE FROM book_topics WHERE topic_id = :topicId", nativeQuery = true)
    int deleteBookLinks(@Param("topicId") UUID topicId);
}
