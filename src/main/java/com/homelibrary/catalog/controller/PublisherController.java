package com.homelibrary.catalog.controller;

import com.homelibrary.catalog.dto.request.PublisherRequest;
import com.homelibrary.catalog.dto.response.PublisherResponse;
import com.homelibrary.catalog.dto.response.PagedResponse;
import com.homelibrary.catalog.service.PublisherService;
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
@RequestMapping("/api/v1/publishers")
@RequiredArgsConstructor
@Tag(name = "Publishers")
public class PublisherController {

    private final PublisherService publisherService;

    @GetMapping
    @Operation(summary = "List all publishers")
    public ResponseEntity<PagedResponse<PublisherResponse>> findAll(Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(publisherService.findAll(pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get by ID")
    @ApiResponse(responseCode = "200", description = "Found")
    @ApiResponse(responseCode = "404", description = "Not found")
    public ResponseEntity<PublisherResponse> findById(@PathVariable UUID id) {
        return ResponseEntity.ok(publisherService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Create")
    @ApiResponse(responseCode = "201", description = "Created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "409", description = "Identifier already exists")
    public ResponseEntity<PublisherResponse> create(@Valid @RequestBody PublisherRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(publisherService.create(request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update")
    @ApiResponse(responseCode = "200", description = "Updated")
    @ApiResponse(responseCode = "404", description = "Not found")
    public ResponseEntity<PublisherResponse> update(@PathVariable UUID id, @Valid @RequestBody PublisherRequest request) {
        return ResponseEntity.ok(publisherService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete", description = "Only publishers without books can be deleted.")
    @ApiResponse(responseCode = "204", description = "Deleted")
    @ApiResponse(responseCode = "404", description = "Not found")
    @ApiResponse(responseCode = "409", description = "Publisher still has books")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        publisherService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
