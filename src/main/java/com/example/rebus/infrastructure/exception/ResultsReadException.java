package com.example.rebus.infrastructure.exception;

/**
 * Signals that a run's {@code results.json} exists but cannot be read or parsed.
 */
public class ResultsReadException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   IO or Jackson failure
	 */
    public ResultsReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
