package com.homelibrary.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * JPA entity representing a catalogued book.
 *
 * <p><strong>Association ownership</strong>: Book is the <em>owning</em> side of every
 * many-to-many it takes part in ({@code book_authors}, {@code book_genres},
 * {@code book_topics}). Link rows are written and removed exclusively through the
 * {@link #authors}, {@link #genres} and {@link #topics} collections. Deleting a Book
 * removes its link rows; it never deletes the linked Author, Genre or Topic rows. Whether
 * an Author left without books should also go is decided by the lifecycle services, not
 * by JPA cascading, so no {@code CascadeType} is declared on any association.
 *
 * <p><strong>Required references</strong>: {@link #publisher} and {@link #category} are
 * {@code optional = false}; the columns are {@code NOT NULL} with {@code ON DELETE
 * RESTRICT}, so a Publisher or Category cannot disappear from under a Book.
 * {@link #series} is optional and paired with {@link #seriesOrder}.
 *
 * <p><strong>Optimistic locking</strong>: {@link #version} is incremented by Hibernate on
 * every UPDATE. A stale concurrent edit surfaces as
 * {@code ObjectOptimisticLockingFailureException}, translated to 409 by
 * {@code GlobalExceptionHandler}.
 *
 * <p>{@code @ToString} is omitted to avoid triggering lazy loads during logging.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Book extends BaseEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    /** Not unique: personal libraries legitimately hold several copies or editions. */
    @Column(name = "isbn", length = 20)
    private String isbn;

    @Column(name = "publication_year")
    private Integer publicationYear;

    @Column(name = "pages")
    private Integer pages;

    @Column(name = "description", length = 5000)
    private String description;

    @Column(name = "cover_image", length = 1000)
    private String coverImage;

    @Enumerated(EnumType.STRING)
    @Column(name = "reading_status", nullable = false, length = 20)
    private ReadingStatus readingStatus = ReadingStatus.UNREAD;

    @Column(name = "notes", length = 10000)
    private String notes;

    /** 0..5 inclusive, checked by {@code chk_books_rating}. */
    @Column(name = "rating")
    private Double rating;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "publisher_id", nullable = false)
    private Publisher publisher;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "series_id")
    private Series series;

    /** Position within {@link #series}; meaningless when the book has no series. */
    @Column(name = "series_order")
    private Integer seriesOrder;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "book_authors",
            joinColumns = @JoinColumn(name = "book_id"),
            inverseJoinColumns = @JoinColumn(name = "author_id")
    )
    @BatchSize(size = 20)
    private Set<Author> authors = new HashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "book_genres",
            joinColumns = @JoinColumn(name = "book_id"),
            inverseJoinColumns = @JoinColumn(name = "genre_id")
    )
    @BatchSize(size = 20)
    private Set<Genre> genres = new HashSet<>();

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "book_topics",
            joinColumns = @JoinColumn(name = "book_id"),
            inverseJoinColumns = @JoinColumn(name = "topic_id")
    )
    @BatchSize(size = 20)
    private Set<Topic> topics = new HashSet<>();
}
