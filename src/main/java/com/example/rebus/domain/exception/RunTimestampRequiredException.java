package com.example.rebus.domain.exception;

/**
 * Raised when a run evaluation is requested without naming the run's timestamp folder.
 */
public class RunTimestampRequiredException extends DomainException {

    public RunTimestampRequiredException() {
        super("Run timestamp is required, e.g. 20250520_142530.");
    }
}
