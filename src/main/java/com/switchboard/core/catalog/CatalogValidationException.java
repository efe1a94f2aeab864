package com.switchboard.core.catalog;

/**
 * Thrown when an intent catalog document is structurally invalid (unparseable,
 * empty, or with duplicate intent names).
 */
public class CatalogValidationException extends RuntimeException {

    public CatalogValidationException(String message) {
        super(message);
    }

    public CatalogValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
