package com.example.rebus.interfaces.api.error;

import com.example.rebus.application.exception.ApplicationException;
import com.example.rebus.application.exception.UseCaseValidationException;
import com.example.rebus.domain.exception.DomainException;
import com.example.rebus.domain.exception.ResultsNotFoundException;
import com.example.rebus.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain, application and infrastructure failures to HTTP responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps {@link ResultsNotFoundException} to a 404 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(ResultsNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResultsNotFound(ResultsNotFoundException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.NOT_FOUND, "RESULTS_NOT_FOUND");
    }

    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomain(DomainException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "DOMAIN_ERROR");
    }

    /**
     * Maps use-case validation exceptions, such as a missing evaluation body, to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(UseCaseValidationException.class)
    public ResponseEntity<ErrorResponse> handleUseCaseValidation(UseCaseValidationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.BAD_REQUEST, "USE_CASE_VALIDATION_ERROR");
    }

    @ExceptionHandler(ApplicationException.class)
    public ResponseEntity<ErrorResponse> handleApplication(ApplicationException ex, HttpServletRequest request) {
        return buildResponse(ex, request, HttpStatus.UNPROCESSABLE_ENTITY, "APPLICATION_ERROR");
    }

    /**
     * Maps unparsable JSON bodies to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        ErrorResponse response = ErrorResponse.of(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST",
                "Request body is missing or is not valid JSON.", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "INFRASTRUCTURE_ERROR");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return buildResponse(ex, request, HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR");
    }

    private ResponseEntity<ErrorResponse> buildResponse(Throwable error,
                                                       HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode) {
        ErrorResponse response = ErrorResponse.of(status, errorCode, error.getMessage(), request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
