package com.homelibrary.catalog.unit.service;

import com.homelibrary.catalog.dto.request.SeriesRequest;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.dto.response.SeriesResponse;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Series;
import com.homelibrary.catalog.exception.BlockedByInvariantException;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.exception.ValidationException;
import com.homelibrary.catalog.repository.AuthorRepository;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.SeriesRepository;
import com.homelibrary.catalog.rules.InvariantViolation;
import com.homelibrary.catalog.rules.ViolationType;
import com.homelibrary.catalog.service.OrphanCleanupService;
import com.homelibrary.catalog.service.SeriesService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeriesServiceTest {

    @Mock
    private SeriesRepository seriesRepository;

    @Mock
    private AuthorRepository authorRepository;

    @Mock
    private BookRepository bookRepository;

    @Mock
    private OrphanCleanupService orphanCleanupService;

    @InjectMocks
    private SeriesService seriesService;

    @Test
    void deleteSeries_withLinkedBooks_isBlockedWithLinkedCount() {
        Series saga = TestData.series("Saga", TestData.author("Writer"));
        when(seriesRepository.findByIdWithAuthors(saga.getId())).thenReturn(Optional.of(saga));
        when(bookRepository.countBySeriesId(saga.getId())).thenReturn(2L);

        BlockedByInvariantException ex = catchThrowableOfType(
            () -> seriesService.delete(saga.getId()), BlockedByInvariantException.class);

        assertThat(ex.getViolations())
            .extracting(InvariantViolation::type, InvariantViolation::entityId, InvariantViolation::linkedCount)
            .containsExactly(tuple(ViolationType.SERIES_HAS_BOOKS, saga.getId(), 2L));
        verify(orphanCleanupService, never()).removeSeries(any());
    }

    @Test
    void deleteSeries_withoutBooks_removesSeries() {
        Series saga = TestData.series("Saga", TestData.author("Writer"));
        when(seriesRepository.findByIdWithAuthors(saga.getId())).thenReturn(Optional.of(saga));
        when(bookRepository.countBySeriesId(saga.getId())).thenReturn(0L);

        seriesService.delete(saga.getId());

        verify(orphanCleanupService).removeSeries(saga);
    }

    @Test
    void deleteSeries_whenNotFound_throwsResourceNotFoundException() {
        UUID id = UUID.randomUUID();
        when(seriesRepository.findByIdWithAuthors(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> seriesService.delete(id))
            .isInstanceOf(ResourceNotFoundException.class);
        verify(orphanCleanupService, never()).removeSeries(any());
    }

    @Test
    void createSeries_withoutAuthors_throwsValidationException() {
        assertThatThrownBy(() -> seriesService.create(new SeriesRequest(null, "Empty", null, List.of())))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("at least one author");

        verify(seriesRepository, never()).save(any());
    }

    @Test
    void updateSeries_replacesAuthorSet() {
        Author original = TestData.author("Original");
        Author replacement = TestData.author("Replacement");
        Series saga = TestData.series("Saga", original);
        when(seriesRepository.findByIdWithAuthors(saga.getId())).thenReturn(Optional.of(saga));
        when(authorRepository.findAllById(any())).thenReturn(List.of(replacement));
        when(seriesRepository.save(saga)).thenReturn(saga);
        when(bookRepository.countBySeriesId(saga.getId())).thenReturn(1L);

        SeriesResponse response = seriesService.update(saga.getId(),
            new SeriesRequest(null, "Saga", null, List.of(replacement.getId())));

        assertThat(response.authors()).extracting(EntityRef::id).containsExactly(replacement.getId());
        assertThat(response.bookCount()).isEqualTo(1L);
    }
}
