package com.gastronomico.directory.service;

import com.gastronomico.directory.exception.ValidationException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Presence and format checks shared by the resource services.
 * Every check runs before the store is touched.
 */
public final class InputValidator {

    // local part, '@', domain containing a dot; no whitespace anywhere
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private InputValidator() {
    }

    /** Returns the trimmed value, or fails when it is null or blank. */
    public static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
        return value.trim();
    }

    /** Trimmed value, or null for null/blank input. */
    public static String trimToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /** Like {@link #trimToNull} but keeps inner content untouched (logos, data URIs). */
    public static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public static boolean isEmail(String value) {
        return value != null && EMAIL.matcher(value).matches();
    }

    /** Validates an already trimmed email. */
    public static String requireEmail(String value, String message) {
        if (!isEmail(value)) {
            throw new ValidationException(message);
        }
        return value;
    }

    public static List<Long> requireIds(List<Long> ids, String message) {
        if (ids == null) return List.of();
        for (Long id : ids) {
            if (id == null) {
                throw new ValidationException(message);
            }
        }
        return ids;
    }
}
