package com.phillippitts.arithmetic.exception;

/**
 * Common parent of the three evaluation failures. Every subclass is a caller-input error
 * and maps to HTTP 400.
 */
public abstract class EvaluationException extends CalculatorException {

    private final EvaluationError error;

    protected EvaluationException(EvaluationError error, String message) {
        super(message);
        this.error = error;
    }

    public EvaluationError getError() {
        return error;
    }
}
