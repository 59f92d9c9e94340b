package com.example.rebus.interfaces.api.error;

import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * JSON body returned when an evaluation request fails.
 * {@code error} is a fixed code such as {@code RESULTS_NOT_FOUND}; {@code message} carries the exception text.
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {
    /**
     * @param status  response status, stored as its numeric code
     * @param error   fixed error code
     * @param message failure detail
     * @param path    URI of the failed request
     * @return error body stamped with the current time
     */
    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status.value(), error, message, path);
    }
}
