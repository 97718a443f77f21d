package com.homelibrary.catalog.service;

import com.homelibrary.catalog.dto.response.CleanupResult;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Publisher;
import com.homelibrary.catalog.entity.Series;
import com.homelibrary.catalog.mapper.AuthorMapper;
import com.homelibrary.catalog.mapper.PublisherMapper;
import com.homelibrary.catalog.mapper.SeriesMapper;
import com.homelibrary.catalog.repository.AuthorRepository;
import com.homelibrary.catalog.repository.PublisherRepository;
import com.homelibrary.catalog.repository.SeriesRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes authors, publishers and series that no book refers to any more, and hosts the
 * single-record removal steps the cascade paths reuse.
 */
@Service
@RequiredArgsConstructor
public class OrphanCleanupService {

    private static final Logger log = LoggerFactory.getLogger(OrphanCleanupService.class);

    private final AuthorRepository authorRepository;
    private final PublisherRepository publisherRepository;
    private final SeriesRepository seriesRepository;

    /**
     * Deletes orphans until a scan finds none. Orphan authors are removed even when that
     * leaves a series without authors; {@code integrityCheck} reports such series.
     */
    @Transactional
    public CleanupResult cleanupOrphans() {
        List<EntityRef> authors = new ArrayList<>();
        List<EntityRef> publishers = new ArrayList<>();
        List<EntityRef> series = new ArrayList<>();

        boolean removedAny;
        do {
            removedAny = false;
            for (Author author : authorRepository.findOrphans()) {
                authors.add(AuthorMapper.toRef(author));
                removeAuthor(author);
                removedAny = true;
            }
            for (Publisher publisher : publisherRepository.findOrphans()) {
                publishers.add(PublisherMapper.toRef(publisher));
                removePublisher(publisher);
                removedAny = true;
            }
            for (Series s : seriesRepository.findOrphans()) {
                series.add(SeriesMapper.toRef(s));
                removeSeries(s);
                removedAny = true;
            }
            authorRepository.flush();
        } while (removedAny);

        CleanupResult result = new CleanupResult(authors, publishers, series);
        if (result.totalDeleted() > 0) {
            log.info("Orphan cleanup removed {} author(s), {} publisher(s), {} series",
                authors.size(), publishers.size(), series.size());
        }
        return result;
    }

    /** Detaches the author from every series, then deletes it. Book links must already be gone. */
    @Transactional
    public void removeAuthor(Author author) {
        for (Series s : List.copyOf(author.getSeries())) {
            s.getAuthors().remove(author);
        }
        author.getSeries().clear();
        authorRepository.delete(author);
        log.debug("Removed author {} ({})", author.getName(), author.getId());
    }

    @Transactional
    public void removePublisher(Publisher publisher) {
        publisherRepository.delete(publisher);
        log.debug("Removed publisher {} ({})", publisher.getName(), publisher.getId());
    }

    /** Series owns {@code series_authors}, so its author links go with it. */
    @Transactional
    public void removeSeries(Series series) {
        for (Author author : series.getAuthors()) {
            author.getSeries().remove(series);
        }
        series.getAuthors().clear();
        seriesRepository.delete(series);
        log.debug("Removed series {} ({})", series.getName(), series.getId());
    }
}
