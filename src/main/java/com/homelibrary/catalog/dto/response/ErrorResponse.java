package com.homelibrary.catalog.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.homelibrary.catalog.rules.InvariantViolation;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    int status,
    String error,
    String message,
    Instant timestamp,
    String path,
    List<FieldError> fieldErrors,
    List<InvariantViolation> violations
) {
    public ErrorResponse(int status, String error, String message,
                         Instant timestamp, String path) {
        this(status, error, message, timestamp, path, List.of(), List.of());
    }

    public ErrorResponse(int status, String error, String message,
                         Instant timestamp, String path, List<FieldError> fieldErrors) {
        this(status, error, message, timestamp, path, fieldErrors, List.of());
    }

    public record FieldError(String field, String message) {}
}
