package com.example.rebus.application.exception;

/**
 * Thrown when an ad-hoc evaluation request carries no records to score.
 */
public class EvaluationRequestValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public EvaluationRequestValidationException(String message) {
        super(message);
    }
}
