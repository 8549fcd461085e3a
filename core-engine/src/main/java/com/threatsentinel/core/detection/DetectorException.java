package com.threatsentinel.core.detection;

/**
 * Raised by a detector stage that could not produce a verdict, e.g. because
 * its backing service is unreachable or answered with garbage.
 *
 * @since 1.0.0
 */
public class DetectorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DetectorException(String message) {
        super(message);
    }

    public DetectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
