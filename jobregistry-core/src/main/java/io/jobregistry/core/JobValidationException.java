package io.jobregistry.core;

/**
 * Thrown before any store access when a registry argument is malformed.
 */
public class JobValidationException extends IllegalArgumentException {

    public JobValidationException(String message) {
        super(message);
    }
}
