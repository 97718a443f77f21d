package com.homelibrary.catalog.controller;

import com.homelibrary.catalog.dto.response.CleanupResult;
import com.homelibrary.catalog.dto.response.IntegrityReport;
import com.homelibrary.catalog.service.ImpactAnalysisService;
import com.homelibrary.catalog.service.OrphanCleanupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/maintenance")
@RequiredArgsConstructor
@Tag(name = "Maintenance", description = "Catalog-wide integrity scan and orphan cleanup")
public class MaintenanceController {

    private final ImpactAnalysisService impactAnalysisService;
    private final OrphanCleanupService orphanCleanupService;

    @GetMapping("/integrity")
    @Operation(summary = "Scan the catalog for cardinality violations", description = "Read-only.")
    public ResponseEntity<IntegrityReport> integrity() {
        return ResponseEntity.ok(impactAnalysisService.integrityCheck());
    }

    @PostMapping("/cleanup-orphans")
    @Operation(summary = "Delete authors, publishers and series without books")
    public ResponseEntity<CleanupResult> cleanupOrphans() {
        return ResponseEntity.ok(orphanCleanupService.cleanupOrphans());
    }
}
