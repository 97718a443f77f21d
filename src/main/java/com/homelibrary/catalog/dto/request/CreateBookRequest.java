package com.homelibrary.catalog.dto.request;

import com.homelibrary.catalog.entity.ReadingStatus;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record CreateBookRequest(

    UUID id,

    @NotBlank(message = "Title must not be blank")
    @Size(max = 500, message = "Title must not exceed 500 characters")
    String title,

    @Size(max = 20, message = "ISBN must not exceed 20 characters")
    String isbn,

    @Min(value = 1000, message = "Publication year must be 1000 or later")
    @Max(value = 2100, message = "Publication year must be 2100 or earlier")
    Integer publicationYear,

    @Positive(message = "Pages must be positive")
    Integer pages,

    @Size(max = 5000, message = "Description must not exceed 5000 characters")
    String description,

    @Size(max = 1000, message = "Cover image must not exceed 1000 characters")
    String coverImage,

    ReadingStatus readingStatus,

    @Size(max = 10000, message = "Notes must not exceed 10000 characters")
    String notes,

    @DecimalMin(value = "0", message = "Rating must be between 0 and 5")
    @DecimalMax(value = "5", message = "Rating must be between 0 and 5")
    Double rating,

    @NotNull(message = "Publisher is required")
    UUID publisherId,

    @NotNull(message = "Category is required")
    UUID categoryId,

    UUID seriesId,

    @Positive(message = "Series order must be positive")
    Integer seriesOrder,

    List<@NotNull UUID> authorIds,

    List<@NotNull UUID> genreIds,

    List<@NotNull UUID> topicIds
) implements BookFields {}
