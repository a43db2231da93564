package com.gastronomico.directory.exception;

/** The store rejected a write because of a unique constraint. */
public class ConflictException extends DirectoryException {

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
