package com.phillippitts.arithmetic.exception;

/**
 * Thrown when an operator tag is not one of {@code add}, {@code sub}, {@code mul}, {@code div}.
 */
public class UnsupportedOperatorException extends EvaluationException {

    private final String tag;

    public UnsupportedOperatorException(String tag) {
        super(EvaluationError.UNSUPPORTED_OPERATOR,
                "Unsupported operator: '" + tag + "'. Expected one of: add, sub, mul, div");
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
