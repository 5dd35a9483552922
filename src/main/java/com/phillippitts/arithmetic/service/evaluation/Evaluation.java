package com.phillippitts.arithmetic.service.evaluation;

import com.phillippitts.arithmetic.domain.CalculationResult;
import com.phillippitts.arithmetic.exception.EvaluationError;
import com.phillippitts.arithmetic.exception.EvaluationException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link ArithmeticEvaluator#evaluate}: exactly one of {@code result} or
 * {@code failure} is non-null.
 *
 * @param result  calculation result on success, otherwise null
 * @param failure typed failure, otherwise null
 */
public record Evaluation(CalculationResult result, EvaluationException failure) {

    public Evaluation {
        if ((result == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of result or failure must be set");
        }
    }

    public static Evaluation success(CalculationResult result) {
        return new Evaluation(Objects.requireNonNull(result, "Result must not be null"), null);
    }

    public static Evaluation failure(EvaluationException failure) {
        return new Evaluation(null, Objects.requireNonNull(failure, "Failure must not be null"));
    }

    public boolean isSuccess() {
        return result != null;
    }

    /**
     * Failure kind, empty on success.
     */
    public Optional<EvaluationError> error() {
        return failure == null ? Optional.empty() : Optional.of(failure.getError());
    }

    /**
     * Returns the result or rethrows the typed failure.
     *
     * @throws EvaluationException if this evaluation failed
     */
    public CalculationResult orElseThrow() {
        if (failure != null) {
            throw failure;
        }
        return result;
    }
}
