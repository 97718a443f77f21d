package com.homelibrary.catalog.controller;

import com.homelibrary.catalog.dto.request.CatalogBatch;
import com.homelibrary.catalog.dto.response.ImportResult;
import com.homelibrary.catalog.service.ImportExportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Import/Export", description = "Whole-catalog transfer")
public class ImportExportController {

    private final ImportExportService importExportService;

    @PostMapping("/import")
    @Operation(summary = "Merge a catalog batch",
        description = "Records whose id already exists are skipped. Rejected records are listed in errors; "
            + "orphans left after the merge are removed and reported there too.")
    @ApiResponse(responseCode = "200", description = "Batch processed")
    @ApiResponse(responseCode = "400", description = "Batch has no format version")
    public ResponseEntity<ImportResult> importBatch(@RequestBody CatalogBatch batch) {
        return ResponseEntity.ok(importExportService.importBatch(batch));
    }

    @GetMapping("/export")
    @Operation(summary = "Export the whole catalog in import format")
    public ResponseEntity<CatalogBatch> export() {
        return ResponseEntity.ok(importExportService.exportCatalog());
    }
}
