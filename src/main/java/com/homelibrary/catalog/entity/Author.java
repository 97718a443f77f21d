package com.homelibrary.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * JPA entity representing a book author.
 *
 * <p><strong>Relationship ownership</strong>: Author is the <em>inverse</em> side of both
 * the Book-Author ({@code book_authors}, owned by {@link Book}) and the Series-Author
 * ({@code series_authors}, owned by {@link Series}) many-to-many associations. Changes to
 * either association must be made through the owning collection. The collections here
 * are read-only views used when building responses and when detaching an Author from its
 * Series before removal.
 *
 * <p>An Author with no books is an orphan. The schema allows it; the lifecycle services
 * prevent it or clean it up.
 */
@Entity
@Table(name = "authors")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Author extends BaseEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "bio", length = 2000)
    private String bio;

    /** Inverse side. Do NOT add {@code CascadeType} here. */
    @ManyToMany(mappedBy = "authors", fetch = FetchType.LAZY)
    @BatchSize(size = 20)
    private Set<Book> books = new HashSet<>();

    @ManyToMany(mappedBy = "authors", fetch = FetchType.LAZY)
    @BatchSize(size = 20)
    private Set<Series> series = new HashSet<>();
}
