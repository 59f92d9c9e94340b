package com.example.rebus.domain.exception;

/**
 * Base type for all domain-level exceptions of the evaluator.
 * Subclasses describe invalid run references without leaking file-system or HTTP details.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule broke
	 */
    protected DomainException(String message) {
        super(message);
    }
}
