package com.homelibrary.catalog.unit.service;

import com.homelibrary.catalog.dto.request.UpdateBookRequest;
import com.homelibrary.catalog.dto.response.AuthorImpactReport;
import com.homelibrary.catalog.dto.response.BookImpactReport;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.dto.response.IntegrityReport;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Book;
import com.homelibrary.catalog.entity.Category;
import com.homelibrary.catalog.entity.Publisher;
import com.homelibrary.catalog.entity.Series;
import com.homelibrary.catalog.exception.ResourceNotFoundException;
import com.homelibrary.catalog.repository.AuthorRepository;
import com.homelibrary.catalog.repository.BookRepository;
import com.homelibrary.catalog.repository.PublisherRepository;
import com.homelibrary.catalog.repository.SeriesRepository;
import com.homelibrary.catalog.rules.ViolationType;
import com.homelibrary.catalog.service.ImpactAnalysisService;
import org.junit.jupiter.api.BeforeEach;
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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImpactAnalysisServiceTest {

    @Mock
    private BookRepository bookRepository;

    @Mock
    private AuthorRepository authorRepository;

    @Mock
    private PublisherRepository publisherRepository;

    @Mock
    private SeriesRepository seriesRepository;

    @InjectMocks
    private ImpactAnalysisService impactAnalysisService;

    private Publisher publisher;
    private Category category;

    @BeforeEach
    void setUp() {
        publisher = TestData.publisher("P1");
        category = TestData.category("General");
    }

    @Test
    void checkDeleteImpact_soleBookOfAuthorAndPublisher_reportsBoth() {
        Author a1 = TestData.author("A1");
        Book x = TestData.book("X", publisher, category, a1);
        when(bookRepository.findByIdWithRelations(x.getId())).thenReturn(Optional.of(x));
        when(authorRepository.countBooksByAuthorId(a1.getId())).thenReturn(1L);
        when(bookRepository.countByPublisherId(publisher.getId())).thenReturn(1L);

        BookImpactReport report = impactAnalysisService.checkDeleteImpact(x.getId());

        assertThat(report.hasImpact()).isTrue();
        assertThat(report.orphanedAuthors()).containsExactly(new EntityRef(a1.getId(), "A1"));
        assertThat(report.orphanedPublisher()).isEqualTo(new EntityRef(publisher.getId(), "P1"));
        assertThat(report.orphanedSeries()).isNull();
        assertThat(report.toViolations())
            .extracting(v -> v.type())
            .containsExactly(ViolationType.ORPHAN_AUTHOR, ViolationType.ORPHAN_PUBLISHER);
    }

    @Test
    void checkDeleteImpact_sharedAuthorAndPublisher_hasNoImpact() {
        Author shared = TestData.author("Shared");
        Book x = TestData.book("X", publisher, category, shared);
        when(bookRepository.findByIdWithRelations(x.getId())).thenReturn(Optional.of(x));
        when(authorRepository.countBooksByAuthorId(shared.getId())).thenReturn(2L);
        when(bookRepository.countByPublisherId(publisher.getId())).thenReturn(3L);

        BookImpactReport report = impactAnalysisService.checkDeleteImpact(x.getId());

        assertThat(report.hasImpact()).isFalse();
        assertThat(report.orphanedAuthors()).isEmpty();
        assertThat(report.orphanedPublisher()).isNull();
    }

    @Test
    void checkDeleteImpact_orphanedAuthorIsSoleAuthorOfOtherSeries_listsSeriesInformationally() {
        Author a1 = TestData.author("A1");
        Series other = TestData.series("Other Saga", a1);
        Book x = TestData.book("X", publisher, category, a1);
        when(bookRepository.findByIdWithRelations(x.getId())).thenReturn(Optional.of(x));
        when(authorRepository.countBooksByAuthorId(a1.getId())).thenReturn(1L);
        when(bookRepository.countByPublisherId(publisher.getId())).thenReturn(2L);

        BookImpactReport report = impactAnalysisService.checkDeleteImpact(x.getId());

        assertThat(report.seriesLosingLastAuthor()).containsExactly(new EntityRef(other.getId(), "Other Saga"));
        assertThat(report.cascadeViolations())
            .extracting(v -> v.type())
            .containsExactly(ViolationType.SOLE_SERIES_AUTHOR);
    }

    @Test
    void checkDeleteImpact_allCoAuthorsOfSurvivingSeriesOrphaned_listsSeries() {
        Author a = TestData.author("A");
        Author b = TestData.author("B");
        Series shared = TestData.series("Shared Saga", a, b);
        Book x = TestData.book("X", publisher, category, a, b);
        when(bookRepository.findByIdWithRelations(x.getId())).thenReturn(Optional.of(x));
        when(authorRepository.countBooksByAuthorId(a.getId())).thenReturn(1L);
        when(authorRepository.countBooksByAuthorId(b.getId())).thenReturn(1L);
        when(bookRepository.countByPublisherId(publisher.getId())).thenReturn(2L);

        BookImpactReport report = impactAnalysisService.checkDeleteImpact(x.getId());

        assertThat(report.seriesLosingLastAuthor()).containsExactly(new EntityRef(shared.getId(), "Shared Saga"));
        assertThat(report.cascadeViolations())
            .extracting(v -> v.entityId())
            .containsExactly(shared.getId());
    }

    @Test
    void checkDeleteImpact_seriesKeepsACoAuthor_isNotListed() {
        Author doomed = TestData.author("Doomed");
        Author survivor = TestData.author("Survivor");
        TestData.series("Shared Saga", doomed, survivor);
        Book x = TestData.book("X", publisher, category, doomed);
        when(bookRepository.findByIdWithRelations(x.getId())).thenReturn(Optional.of(x));
        when(authorRepository.countBooksByAuthorId(doomed.getId())).thenReturn(1L);
        when(bookRepository.countByPublisherId(publisher.getId())).thenReturn(2L);

        BookImpactReport report = impactAnalysisService.checkDeleteImpact(x.getId());

        assertThat(report.orphanedAuthors()).extracting(EntityRef::name).containsExactly("Doomed");
        assertThat(report.seriesLosingLastAuthor()).isEmpty();
    }

    @Test
    void checkDeleteImpact_seriesOrphanedWithTheBook_isNotListedAsLosingItsAuthor() {
        Author a1 = TestData.author("A1");
        Series saga = TestData.series("Saga", a1);
        Book x = TestData.book("X", publisher, category, a1);
        x.setSeries(saga);
        when(bookRepository.findByIdWithRelations(x.getId())).thenReturn(Optional.of(x));
        when(authorRepository.countBooksByAuthorId(a1.getId())).thenReturn(1L);
        when(bookRepository.countByPublisherId(publisher.getId())).thenReturn(2L);
        when(bookRepository.countBySeriesId(saga.getId())).thenReturn(1L);

        BookImpactReport report = impactAnalysisService.checkDeleteImpact(x.getId());

        assertThat(report.orphanedSeries()).isEqualTo(new EntityRef(saga.getId(), "Saga"));
        assertThat(report.seriesLosingLastAuthor()).isEmpty();
    }

    @Test
    void checkDeleteImpact_whenBookMissing_throwsResourceNotFoundException() {
        UUID id = UUID.randomUUID();
        when(bookRepository.findByIdWithRelations(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> impactAnalysisService.checkDeleteImpact(id))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining(id.toString());
    }

    @Test
    void checkUpdateImpact_onlyConsidersDroppedLinks() {
        Author dropped = TestData.author("Dropped");
        Author kept = TestData.author("Kept");
        Series saga = TestData.series("Saga", kept);
        Book x = TestData.book("X", publisher, category, dropped, kept);
        x.setSeries(saga);
        when(bookRepository.findByIdWithRelations(x.getId())).thenReturn(Optional.of(x));
        when(authorRepository.countBooksByAuthorId(dropped.getId())).thenReturn(1L);
        when(bookRepository.countBySeriesId(saga.getId())).thenReturn(1L);

        BookImpactReport report = impactAnalysisService.checkUpdateImpact(x.getId(),
            proposal(publisher.getId(), null, List.of(kept.getId())));

        assertThat(report.orphanedAuthors()).extracting(EntityRef::name).containsExactly("Dropped");
        assertThat(report.orphanedSeries()).isNotNull();
        assertThat(report.orphanedPublisher()).isNull();
        verify(bookRepository, never()).countByPublisherId(any());
        verify(authorRepository, never()).countBooksByAuthorId(kept.getId());
    }

    @Test
    void checkUpdateImpact_publisherReplaced_reportsOldPublisherWhenLastBook() {
        Author a1 = TestData.author("A1");
        Book x = TestData.book("X", publisher, category, a1);
        when(bookRepository.findByIdWithRelations(x.getId())).thenReturn(Optional.of(x));
        when(bookRepository.countByPublisherId(publisher.getId())).thenReturn(1L);

        BookImpactReport report = impactAnalysisService.checkUpdateImpact(x.getId(),
            proposal(UUID.randomUUID(), null, List.of(a1.getId())));

        assertThat(report.hasImpact()).isTrue();
        assertThat(report.orphanedPublisher()).isEqualTo(new EntityRef(publisher.getId(), "P1"));
        assertThat(report.orphanedAuthors()).isEmpty();
    }

    @Test
    void checkAuthorDeleteImpact_soleSeriesAuthor_hasImpact() {
        Author a1 = TestData.author("A1");
        Series saga = TestData.series("Saga", a1);
        when(authorRepository.existsById(a1.getId())).thenReturn(true);
        when(seriesRepository.findWhereSoleAuthor(a1.getId())).thenReturn(List.of(saga));

        AuthorImpactReport report = impactAnalysisService.checkAuthorDeleteImpact(a1.getId());

        assertThat(report.hasImpact()).isTrue();
        assertThat(report.seriesWithNoAuthors()).extracting(EntityRef::name).containsExactly("Saga");
    }

    @Test
    void checkAuthorDeleteImpact_whenAuthorMissing_throwsResourceNotFoundException() {
        UUID id = UUID.randomUUID();
        when(authorRepository.existsById(id)).thenReturn(false);

        assertThatThrownBy(() -> impactAnalysisService.checkAuthorDeleteImpact(id))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Author");
    }

    @Test
    void integrityCheck_reportsEachFindingWithSummaryCounts() {
        Author orphan = TestData.author("Lonely");
        Series authorless = TestData.series("Empty Saga");
        when(authorRepository.findOrphans()).thenReturn(List.of(orphan));
        when(publisherRepository.findOrphans()).thenReturn(List.of());
        when(seriesRepository.findOrphans()).thenReturn(List.of());
        when(seriesRepository.findWithoutAuthors()).thenReturn(List.of(authorless));
        when(bookRepository.findWithoutPublisher()).thenReturn(List.of());
        when(bookRepository.findWithoutCategory()).thenReturn(List.of());

        IntegrityReport report = impactAnalysisService.integrityCheck();

        assertThat(report.isValid()).isFalse();
        assertThat(report.violations())
            .extracting(v -> v.type())
            .containsExactly(ViolationType.ORPHAN_AUTHOR, ViolationType.SERIES_WITHOUT_AUTHORS);
        assertThat(report.violations().get(0).message()).startsWith("Author \"Lonely\" has no books");
        assertThat(report.violations().get(1).message()).startsWith("Series \"Empty Saga\" has no authors");
        assertThat(report.summary().orphanAuthors()).isEqualTo(1);
        assertThat(report.summary().seriesWithNoAuthors()).isEqualTo(1);
        assertThat(report.summary().orphanPublishers()).isZero();
    }

    @Test
    void integrityCheck_cleanCatalog_isValid() {
        when(authorRepository.findOrphans()).thenReturn(List.of());
        when(publisherRepository.findOrphans()).thenReturn(List.of());
        when(seriesRepository.findOrphans()).thenReturn(List.of());
        when(seriesRepository.findWithoutAuthors()).thenReturn(List.of());
        when(bookRepository.findWithoutPublisher()).thenReturn(List.of());
        when(bookRepository.findWithoutCategory()).thenReturn(List.of());

        IntegrityReport report = impactAnalysisService.integrityCheck();

        assertThat(report.isValid()).isTrue();
        assertThat(report.violations()).isEmpty();
    }

    private static UpdateBookRequest proposal(UUID publisherId, UUID seriesId, List<UUID> authorIds) {
        return new UpdateBookRequest("X", null, null, null, null, null, null, null, null,
            publisherId, UUID.randomUUID(), seriesId, null, authorIds, List.of(), List.of());
    }
}
