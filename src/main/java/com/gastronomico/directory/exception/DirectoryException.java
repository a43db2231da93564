package com.gastronomico.directory.exception;

/**
 * Base type for failures that are the client's fault. The message is
 * returned to the caller as-is, so it must not carry internal detail.
 */
public abstract class DirectoryException extends RuntimeException {

    protected DirectoryException(String message) {
        super(message);
    }

    protected DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
