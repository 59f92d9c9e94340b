package com.example.rebus.application.exception;

/**
 * Signals validation issues detected while running an application layer use case.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
