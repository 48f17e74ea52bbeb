package com.example.brd.model;

/**
 * Raised when the sections JSON cannot yield a usable taxonomy: unreadable or
 * non-object content, a missing {@code sections} array, or no valid section id.
 */
public class TaxonomyConfigurationException extends RuntimeException {

    public TaxonomyConfigurationException(String message) {
        super(message);
    }

    public TaxonomyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
