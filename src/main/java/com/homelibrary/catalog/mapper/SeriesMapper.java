package com.homelibrary.catalog.mapper;

import com.homelibrary.catalog.dto.request.SeriesRequest;
import com.homelibrary.catalog.dto.response.EntityRef;
import com.homelibrary.catalog.dto.response.SeriesResponse;
import com.homelibrary.catalog.entity.Author;
import com.homelibrary.catalog.entity.Series;

import java.util.Comparator;
import java.util.UUID;

public final class SeriesMapper {

    private SeriesMapper() {}

    /** Authors are attached by the caller. */
    public static Series toEntity(SeriesRequest request) {
        Series series = new Series();
        series.setId(request.id() != null ? request.id() : UUID.randomUUID());
        updateEntity(series, request);
        return series;
    }

    public static void updateEntity(Series series, SeriesRequest request) {
        series.setName(request.name());
        series.setDescription(request.description());
    }

    public static SeriesResponse toResponse(Series series, long bookCount) {
        return new SeriesResponse(
            series.getId(),
            series.getName(),
            series.getDescription(),
            series.getAuthors().stream()
                .map(AuthorMapper::toRef)
                .sorted(Comparator.comparing(EntityRef::name))
                .toList(),
            bookCount,
            series.getCreatedAt(),
            series.getUpdatedAt()
        );
    }

    public static EntityRef toRef(Series series) {
        return new EntityRef(series.getId(), series.getName());
    }

    public static SeriesRequest toRecord(Series series) {
        return new SeriesRequest(series.getId(), series.getName(), series.getDescription(),
            series.getAuthors().stream().map(Author::getId).sorted().toList());
    }
}
