package com.example.rebus.domain.exception;

/**
 * Raised when a run timestamp contains characters that could escape the logs directory.
 */
public class InvalidRunTimestampException extends DomainException {

	/**
	 * @param timestamp offending value supplied by the caller
	 */
    public InvalidRunTimestampException(String timestamp) {
        super("Invalid run timestamp: " + timestamp);
    }
}
