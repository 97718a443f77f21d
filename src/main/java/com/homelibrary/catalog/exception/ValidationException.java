package com.homelibrary.catalog.exception;

/**
 * Semantically malformed input to a mutation that Bean Validation cannot express,
 * e.g. an import batch without a format version.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
