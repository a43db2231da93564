package com.gastronomico.directory.exception;

/** The resource addressed by the request path does not exist. */
public class ResourceNotFoundException extends DirectoryException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
