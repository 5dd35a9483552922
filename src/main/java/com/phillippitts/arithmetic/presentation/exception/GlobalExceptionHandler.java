package com.phillippitts.arithmetic.presentation.exception;

import com.phillippitts.arithmetic.exception.EvaluationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain and request-binding exceptions to HTTP responses. Every evaluation failure is
 * a client error (400); internal details of unexpected errors are never returned to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid operand, division by zero or unsupported operator (HTTP 400).
     */
    @ExceptionHandler(EvaluationException.class)
    ResponseEntity<ApiError> handleEvaluationFailure(EvaluationException ex) {
        LOG.warn("Evaluation failed: kind={}, reason={}", ex.getError(), ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), summaryFor(ex), ex.getMessage());
    }

    /**
     * Client error - required query parameter absent (HTTP 400).
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException ex) {
        LOG.warn("Missing request parameter: {}", ex.getParameterName());
        return badRequest(ex.getClass().getSimpleName(), "Missing parameter",
                "Required parameter '" + ex.getParameterName() + "' is missing");
    }

    /**
     * Client error - query or path value not convertible, e.g. {@code a=abc} (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        LOG.warn("Parameter type mismatch: name={}, value={}", ex.getName(), ex.getValue());
        return badRequest(ex.getClass().getSimpleName(), "Invalid parameter",
                "Parameter '" + ex.getName() + "' must be a number, got: '" + ex.getValue() + "'");
    }

    /**
     * Client error - body missing, malformed JSON or non-numeric operand (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return badRequest(ex.getClass().getSimpleName(), "Malformed request body",
                "Expected a JSON object like {\"a\": 3, \"b\": 5}");
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        LOG.warn("Request body validation failed: {}", details);
        return badRequest(ex.getClass().getSimpleName(), "Invalid request body", details);
    }

    /**
     * Catch-all. Spring's own {@link ErrorResponse} exceptions (404, 405, 415...) keep their
     * status; anything else is an unexpected error (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            LOG.warn("Request rejected: status={}, reason={}", status.value(), ex.getMessage());
            HttpStatus resolved = HttpStatus.resolve(status.value());
            return ResponseEntity
                .status(status)
                .body(new ApiError(
                    ex.getClass().getSimpleName(),
                    resolved != null ? resolved.getReasonPhrase() : "Request failed",
                    errorResponse.getBody().getDetail(),
                    Instant.now()
                ));
        }

        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static String summaryFor(EvaluationException ex) {
        return switch (ex.getError()) {
            case INVALID_OPERAND -> "Invalid operand";
            case UNDEFINED_OPERATION -> "Division by zero";
            case UNSUPPORTED_OPERATOR -> "Unsupported operator";
        };
    }

    private static ResponseEntity<ApiError> badRequest(String errorCode, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(errorCode, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
