package org.carball.motif.repository;

/**
 * Raised when the repository cannot read or write its persisted form.
 */
public class SolutionStorageException extends RuntimeException {

    public SolutionStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
