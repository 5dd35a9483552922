package com.phillippitts.arithmetic.service.calculation;

import com.phillippitts.arithmetic.domain.CalculationResult;
import com.phillippitts.arithmetic.domain.Operator;
import com.phillippitts.arithmetic.exception.EvaluationException;
import com.phillippitts.arithmetic.service.evaluation.ArithmeticEvaluator;
import com.phillippitts.arithmetic.service.evaluation.Evaluation;
import com.phillippitts.arithmetic.service.metrics.CalculationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

/**
 * Entry point used by the controllers: runs the evaluator, records metrics and logs the outcome.
 *
 * <p>Failed evaluations are rethrown as their typed {@link EvaluationException} so the
 * {@code GlobalExceptionHandler} can turn them into 400 responses.
 */
@Service
public class CalculationService {

    private static final Logger LOG = LogManager.getLogger(CalculationService.class);

    private final ArithmeticEvaluator evaluator;
    private final CalculationMetrics metrics;

    public CalculationService(ArithmeticEvaluator evaluator, CalculationMetrics metrics) {
        this.evaluator = evaluator;
        this.metrics = metrics;
    }

    /**
     * Evaluates {@code a op b} with an operator tag taken straight from the request.
     *
     * @throws EvaluationException on invalid operand, unsupported operator or division by zero
     */
    public CalculationResult calculate(double a, double b, String operatorTag) {
        String metricTag = Operator.lookup(operatorTag)
                .map(Operator::tag)
                .orElse(CalculationMetrics.UNKNOWN_OPERATOR);
        return record(evaluator.evaluate(a, b, operatorTag), metricTag);
    }

    /**
     * Evaluates {@code a op b} for an already-parsed operator.
     *
     * @throws EvaluationException on invalid operand or division by zero
     */
    public CalculationResult calculate(double a, double b, Operator op) {
        return record(evaluator.evaluate(a, b, op), op.tag());
    }

    private CalculationResult record(Evaluation evaluation, String metricTag) {
        if (!evaluation.isSuccess()) {
            EvaluationException failure = evaluation.failure();
            metrics.incrementFailure(metricTag, failure.getError());
            LOG.info("Evaluation rejected: operator={}, reason={}", metricTag, failure.getError().code());
            throw failure;
        }

        CalculationResult result = evaluation.result();
        metrics.incrementSuccess(metricTag);
        if (!result.hasFiniteResult()) {
            LOG.warn("Non-finite result: {} {} {} = {}",
                    result.a(), result.operator().symbol(), result.b(), result.result());
        } else {
            LOG.debug("Evaluated {} {} {} = {}",
                    result.a(), result.operator().symbol(), result.b(), result.result());
        }
        return result;
    }
}
