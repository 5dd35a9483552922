package com.phillippitts.arithmetic.service.evaluation;

import com.phillippitts.arithmetic.domain.CalculationResult;
import com.phillippitts.arithmetic.domain.Operator;
import com.phillippitts.arithmetic.exception.EvaluationException;
import com.phillippitts.arithmetic.exception.InvalidOperandException;
import com.phillippitts.arithmetic.exception.UndefinedOperationException;
import com.phillippitts.arithmetic.exception.UnsupportedOperatorException;
import org.springframework.stereotype.Component;

/**
 * Validates two operands and an operator, then performs the arithmetic.
 *
 * <p>Stateless and side-effect free: no logging, no I/O, no shared mutable state. Safe to call
 * concurrently from any number of request threads.
 *
 * <p>Validation order is fixed: operand {@code a}, then operand {@code b}, then the operator,
 * then the operator-specific precondition (non-zero divisor for {@link Operator#DIV}).
 */
@Component
public class ArithmeticEvaluator {

    /**
     * Returns true when {@code x} is neither infinite nor NaN.
     */
    public static boolean isFinite(double x) {
        return Double.isFinite(x);
    }

    /**
     * Evaluates {@code a op b} where {@code op} is an unparsed operator tag.
     *
     * <p>Never throws for caller-input errors; they are returned as a failed {@link Evaluation}.
     *
     * @param a first operand
     * @param b second operand
     * @param operatorTag operator tag ({@code add}, {@code sub}, {@code mul}, {@code div})
     * @return successful or failed evaluation
     */
    public Evaluation evaluate(double a, double b, String operatorTag) {
        try {
            requireFiniteOperands(a, b);
            Operator op = Operator.fromTag(operatorTag);
            return Evaluation.success(new CalculationResult(a, b, op, apply(a, b, op)));
        } catch (EvaluationException e) {
            return Evaluation.failure(e);
        }
    }

    /**
     * Typed-operator variant of {@link #evaluate(double, double, String)}.
     */
    public Evaluation evaluate(double a, double b, Operator op) {
        try {
            return Evaluation.success(new CalculationResult(a, b, op, compute(a, b, op)));
        } catch (EvaluationException e) {
            return Evaluation.failure(e);
        }
    }

    /**
     * Computes {@code a op b}.
     *
     * @return arithmetic result, possibly infinite on overflow
     * @throws InvalidOperandException if either operand is not finite
     * @throws UndefinedOperationException if {@code op} is DIV and {@code b} is zero
     * @throws UnsupportedOperatorException if {@code op} is null
     */
    public double compute(double a, double b, Operator op) {
        requireFiniteOperands(a, b);
        return apply(a, b, op);
    }

    private static void requireFiniteOperands(double a, double b) {
        if (!isFinite(a)) {
            throw new InvalidOperandException("a", a);
        }
        if (!isFinite(b)) {
            throw new InvalidOperandException("b", b);
        }
    }

    private static double divide(double a, double b) {
        // -0.0 == 0 holds, so negative zero is rejected as well
        if (b == 0) {
            throw UndefinedOperationException.divisionByZero();
        }
        return a / b;
    }

    private static double apply(double a, double b, Operator op) {
        if (op == null) {
            throw new UnsupportedOperatorException(null);
        }
        return switch (op) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> divide(a, b);
        };
    }
}
