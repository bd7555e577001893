package com.ledgerly.backend.exceptions;

/**
 * Raised when the categorizer artifact cannot be read, written or trained.
 */
public class CategoryModelException extends RuntimeException {

    public CategoryModelException(String message) {
        super(message);
    }

    public CategoryModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
