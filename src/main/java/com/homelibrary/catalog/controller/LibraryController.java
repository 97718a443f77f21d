package com.homelibrary.catalog.controller;

import com.homelibrary.catalog.dto.response.LibraryStatsResponse;
import com.homelibrary.catalog.service.LibraryStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library")
@RequiredArgsConstructor
@Tag(name = "Library")
public class LibraryController {

    private final LibraryStatsService libraryStatsService;

    @GetMapping("/stats")
    @Operation(summary = "Totals, reading progress and most-used genres and authors")
    public ResponseEntity<LibraryStatsResponse> stats() {
        return ResponseEntity.ok(libraryStatsService.getStats());
    }
}
