package com.gastronomico.directory.exception;

/** A required field is missing or malformed. Raised before any store access. */
public class ValidationException extends DirectoryException {

    public ValidationException(String message) {
        super(message);
    }
}
