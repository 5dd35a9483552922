package com.phillippitts.arithmetic.exception;

/**
 * Kinds of caller-input failure an evaluation can produce.
 */
public enum EvaluationError {

    /** An operand is infinite or NaN. */
    INVALID_OPERAND("invalid_operand"),

    /** Division with an exact zero divisor. */
    UNDEFINED_OPERATION("undefined_operation"),

    /** Operator tag outside the closed set. */
    UNSUPPORTED_OPERATOR("unsupported_operator");

    private final String code;

    EvaluationError(String code) {
        this.code = code;
    }

    /**
     * Stable lowercase code, used as a metrics tag.
     */
    public String code() {
        return code;
    }
}
