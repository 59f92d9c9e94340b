package com.example.rebus.infrastructure.exception;

/**
 * Signals that {@code metrics.json} could not be written next to the run's results.
 */
public class MetricsWriteException extends InfrastructureException {

    public MetricsWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
