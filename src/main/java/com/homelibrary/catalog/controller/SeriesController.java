package com.homelibrary.catalog.controller;

import com.homelibrary.catalog.dto.request.SeriesRequest;
import com.homelibrary.catalog.dto.response.SeriesResponse;
import com.homelibrary.catalog.dto.response.PagedResponse;
import com.homelibrary.catalog.service.SeriesService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/series")
@RequiredArgsConstructor
@Tag(name = "Series")
public class SeriesController {

    private final SeriesService seriesService;

    @GetMapping
    @Operation(summary = "List all series")
    public ResponseEntity<PagedResponse<SeriesResponse>> findAll(Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(seriesService.findAll(pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get by ID")
    @ApiResponse(responseCode = "200", description = "Found")
    @ApiResponse(responseCode = "404", description = "Not found")
    public ResponseEntity<SeriesResponse> findById(@PathVariable UUID id) {
        return ResponseEntity.ok(seriesService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Create a series", description = "At least one existing author is required.")
    @ApiResponse(responseCode = "201", description = "Created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "409", description = "Identifier already exists")
    public ResponseEntity<SeriesResponse> create(@Valid @RequestBody SeriesRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(seriesService.create(request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update")
    @ApiResponse(responseCode = "200", description = "Updated")
    @ApiResponse(responseCode = "404", description = "Not found")
    public ResponseEntity<SeriesResponse> update(@PathVariable UUID id, @Valid @RequestBody SeriesRequest request) {
        return ResponseEntity.ok(seriesService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete", description = "Only series without books can be deleted; their author links are removed.")
    @ApiResponse(responseCode = "204", description = "Deleted")
    @ApiResponse(responseCode = "404", description = "Not found")
    @ApiResponse(responseCode = "409", description = "Series still has books")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        seriesService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
