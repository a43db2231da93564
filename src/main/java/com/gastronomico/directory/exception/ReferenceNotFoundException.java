package com.gastronomico.directory.exception;

/**
 * A request body points at a parent record (city, sponsor) that does not
 * exist. Unlike {@link ResourceNotFoundException} this is a 400: the
 * addressed resource is fine, its payload is not.
 */
public class ReferenceNotFoundException extends DirectoryException {

    public ReferenceNotFoundException(String message) {
        super(message);
    }
}
