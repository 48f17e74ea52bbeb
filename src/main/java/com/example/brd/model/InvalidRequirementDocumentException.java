package com.example.brd.model;

/**
 * An uploaded requirements file is not a JSON object.
 */
public class InvalidRequirementDocumentException extends RuntimeException {

    public InvalidRequirementDocumentException(String message) {
        super(message);
    }

    public InvalidRequirementDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
