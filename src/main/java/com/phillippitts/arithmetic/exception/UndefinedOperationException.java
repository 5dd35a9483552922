package com.phillippitts.arithmetic.exception;

import com.phillippitts.arithmetic.domain.Operator;

/**
 * Thrown when an operation is undefined for otherwise valid operands.
 * Currently the only case is division by exact zero.
 */
public class UndefinedOperationException extends EvaluationException {

    private final Operator operator;

    public UndefinedOperationException(Operator operator, String reason) {
        super(EvaluationError.UNDEFINED_OPERATION, "Operation '" + operator.tag() + "' is undefined: " + reason);
        this.operator = operator;
    }

    public static UndefinedOperationException divisionByZero() {
        return new UndefinedOperationException(Operator.DIV, "cannot divide by zero");
    }

    public Operator getOperator() {
        return operator;
    }
}
