package com.example.rebus.domain.exception;

/**
 * Raised when the results file of a referenced run does not exist on disk.
 */
public class ResultsNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute path of the expected {@code results.json}
	 */
    public ResultsNotFoundException(String path) {
        super("No results.json at " + path);
    }
}
