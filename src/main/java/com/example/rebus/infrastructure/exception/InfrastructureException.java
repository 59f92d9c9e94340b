package com.example.rebus.infrastructure.exception;

/**
 * Failure reading a run's {@code results.json} or writing its {@code metrics.json}.
 * Always wraps the underlying I/O or Jackson exception.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message names the file that could not be read or written
	 * @param cause   the I/O or JSON mapping error
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
