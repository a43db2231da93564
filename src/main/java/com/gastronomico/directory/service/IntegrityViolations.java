package com.gastronomico.directory.service;

import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;

/**
 * Tells unique-key violations apart from the other integrity failures
 * Spring folds into {@link DataIntegrityViolationException} (value too
 * long, not-null, foreign key).
 */
final class IntegrityViolations {

    /** SQLState for unique_violation on PostgreSQL and H2. */
    static final String UNIQUE_VIOLATION = "23505";

    private IntegrityViolations() {
    }

    static boolean isUniqueViolation(DataIntegrityViolationException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException
                    && UNIQUE_VIOLATION.equals(((SQLException) current).getSQLState())) {
                return true;
            }
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return false;
    }
}
