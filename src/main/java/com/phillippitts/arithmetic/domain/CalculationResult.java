package com.phillippitts.arithmetic.domain;

import java.util.Objects;

/**
 * Immutable outcome of a single successful evaluation.
 *
 * <p>{@code a} and {@code b} are always finite; {@code result} may not be (a finite product or
 * quotient can overflow to infinity).
 *
 * @param a        first operand
 * @param b        second operand
 * @param operator operator that was actually applied
 * @param result   arithmetic result
 */
public record CalculationResult(
        double a,
        double b,
        Operator operator,
        double result
) {

    /**
     * @throws NullPointerException if operator is null
     */
    public CalculationResult {
        Objects.requireNonNull(operator, "Operator must not be null");
    }

    /**
     * Whether the result is a finite number.
     */
    public boolean hasFiniteResult() {
        return Double.isFinite(result);
    }
}
