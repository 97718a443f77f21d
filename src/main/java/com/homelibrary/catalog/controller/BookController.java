package com.homelibrary.catalog.controller;

import com.homelibrary.catalog.dto.request.CreateBookRequest;
import com.homelibrary.catalog.dto.request.ReadingProgressRequest;
import com.homelibrary.catalog.dto.request.UpdateBookRequest;
import com.homelibrary.catalog.dto.response.BookImpactReport;
import com.homelibrary.catalog.dto.response.BookResponse;
import com.homelibrary.catalog.dto.response.DeleteResult;
import com.homelibrary.catalog.dto.response.PagedResponse;
import com.homelibrary.catalog.service.BookService;
import com.homelibrary.catalog.service.ImpactAnalysisService;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Book management and guarded delete/update")
public class BookController {

    private final BookService bookService;
    private final ImpactAnalysisService impactAnalysisService;

    @GetMapping
    @Operation(summary = "List all books", description = "Returns a paginated list of books with their linked records.")
    public ResponseEntity<PagedResponse<BookResponse>> findAll(Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(bookService.findAll(pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get book by ID")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> findById(@PathVariable UUID id) {
        return ResponseEntity.ok(bookService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Create a new book", description = "Publisher and category are required. All referenced records must exist.")
    @ApiResponse(responseCode = "201", description = "Book created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "A referenced record does not exist")
    public ResponseEntity<BookResponse> create(@Valid @RequestBody CreateBookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookService.create(request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Replace a book's state",
        description = "Link lists replace the current links. If the change would leave an author, publisher or "
            + "series without books it is refused unless cascadeOrphans=true, in which case those records "
            + "are deleted in the same transaction.")
    @ApiResponse(responseCode = "200", description = "Book updated")
    @ApiResponse(responseCode = "404", description = "Book or a referenced record not found")
    @ApiResponse(responseCode = "409", description = "Update would orphan records, or the book was modified concurrently")
    public ResponseEntity<BookResponse> update(@PathVariable UUID id,
                                               @RequestParam(defaultValue = "false") boolean cascadeOrphans,
                                               @Valid @RequestBody UpdateBookRequest request) {
        return ResponseEntity.ok(bookService.update(id, request, cascadeOrphans));
    }

    @PutMapping("/{id}/progress")
    @Operation(summary = "Update reading status and notes")
    @ApiResponse(responseCode = "200", description = "Progress updated")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> updateProgress(@PathVariable UUID id,
                                                       @Valid @RequestBody ReadingProgressRequest request) {
        return ResponseEntity.ok(bookService.updateProgress(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a book",
        description = "Refused with 409 when the book is the last one of an author, publisher or series, "
            + "unless cascadeOrphans=true.")
    @ApiResponse(responseCode = "200", description = "Book deleted; body lists every removed record")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "409", description = "Delete would orphan records")
    public ResponseEntity<DeleteResult> delete(@PathVariable UUID id,
                                               @RequestParam(defaultValue = "false") boolean cascadeOrphans) {
        return ResponseEntity.ok(bookService.delete(id, cascadeOrphans));
    }

    @GetMapping("/{id}/delete-impact")
    @Operation(summary = "Preview what deleting a book would orphan")
    public ResponseEntity<BookImpactReport> deleteImpact(@PathVariable UUID id) {
        return ResponseEntity.ok(impactAnalysisService.checkDeleteImpact(id));
    }

    @PostMapping("/{id}/update-impact")
    @Operation(summary = "Preview what replacing a book's state would orphan")
    public ResponseEntity<BookImpactReport> updateImpact(@PathVariable UUID id,
                                                         @Valid @RequestBody UpdateBookRequest request) {
        return ResponseEntity.ok(impactAnalysisService.checkUpdateImpact(id, request));
    }
}
