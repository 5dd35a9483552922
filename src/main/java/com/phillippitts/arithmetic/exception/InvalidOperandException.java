package com.phillippitts.arithmetic.exception;

/**
 * Thrown when an operand is not a finite number (positive/negative infinity or NaN).
 */
public class InvalidOperandException extends EvaluationException {

    private final String operandName;
    private final double value;

    public InvalidOperandException(String operandName, double value) {
        super(EvaluationError.INVALID_OPERAND,
                "Operand '" + operandName + "' must be a finite number (Inf/NaN not allowed), got: " + value);
        this.operandName = operandName;
        this.value = value;
    }

    public String getOperandName() {
        return operandName;
    }

    public double getValue() {
        return value;
    }
}
