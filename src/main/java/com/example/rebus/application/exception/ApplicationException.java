package com.example.rebus.application.exception;

/**
 * Base unchecked exception for failures in the application layer.
 * Use cases throw subclasses of this type for request problems that are neither
 * domain rule violations nor IO failures.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message human readable error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
