package com.phillippitts.arithmetic.exception;

/**
 * Base exception for all calculator application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CalculatorException extends RuntimeException {

    public CalculatorException(String message) {
        super(message);
    }

    public CalculatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
