package com.homelibrary.catalog.service;

import com.homelibrary.catalog.config.CatalogProperties;
import com.homelibrary.catalog.dto.response.LibraryStatsResponse;
import com.homelibrary.catalog.entity.EntityKind;
import com.homelibrary.catalog.entity.ReadingStatus;
import com.homelibrary.catalog.repository.AuthorRepository;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.CategoryRepository;
import com.homelibrary.catalog.repository.GenreRepository;
import com.homelibrary.catalog.repository.PublisherRepository;
import com.homelibrary.catalog.repository.SeriesRepository;
import com.homelibrary.catalog.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class LibraryStatsService {

    private final BookRepository bookRepository;
    private final AuthorRepository authorRepository;
    private final PublisherRepository publisherRepository;
    private final SeriesRepository seriesRepository;
    private final GenreRepository genreRepository;
    private final TopicRepository topicRepository;
    private final CategoryRepository categoryRepository;
    private final CatalogProperties catalogProperties;

    @Transactional(readOnly = true)
    public LibraryStatsResponse getStats() {
        Map<EntityKind, Long> totals = new EnumMap<>(EntityKind.class);
        totals.put(EntityKind.BOOK, bookRepository.count());
        totals.put(EntityKind.AUTHOR, authorRepository.count());
        totals.put(EntityKind.PUBLISHER, publisherRepository.count());
        totals.put(EntityKind.SERIES, seriesRepository.count());
        totals.put(EntityKind.GENRE, genreRepository.count());
        totals.put(EntityKind.TOPIC, topicRepository.count());
        totals.put(EntityKind.CATEGORY, categoryRepository.count());

        Map<ReadingStatus, Long> byStatus = new EnumMap<>(ReadingStatus.class);
        for (ReadingStatus status : ReadingStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (Object[] row : bookRepository.countByReadingStatus()) {
            byStatus.put((ReadingStatus) row[0], (Long) row[1]);
        }

        PageRequest top = PageRequest.of(0, catalogProperties.getStatsTopLimit());
        return new LibraryStatsResponse(
            totals,
            byStatus,
            toNamedCounts(genreRepository.findTopByBookCount(top)),
            toNamedCounts(authorRepository.findTopByBookCount(top))
        );
    }

    private static List<LibraryStatsResponse.NamedCount> toNamedCounts(List<Object[]> rows) {
        return rows.stream()
            .map(row -> new LibraryStatsResponse.NamedCount((String) row[0], (Long) row[1]))
            .toList();
    }
}
