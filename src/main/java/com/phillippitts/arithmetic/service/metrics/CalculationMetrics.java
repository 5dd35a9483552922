package com.phillippitts.arithmetic.service.metrics;

import com.phillippitts.arithmetic.exception.EvaluationError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Micrometer instrumentation for calculator evaluations.
 *
 * <p>Provides:
 * <ul>
 *   <li>Success counts per operator</li>
 *   <li>Failure counts per operator and failure kind</li>
 * </ul>
 *
 * <p>Exposed under {@code /actuator/metrics/calculator.evaluation.*}.
 */
@Component
public class CalculationMetrics {

    static final String METRIC_PREFIX = "calculator.evaluation";

    /** Operator tag used when the caller's tag did not parse. */
    public static final String UNKNOWN_OPERATOR = "unknown";

    private final MeterRegistry registry;

    public CalculationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the success counter for an operator.
     *
     * @param operatorTag operator tag (add, sub, mul, div)
     */
    public void incrementSuccess(String operatorTag) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful evaluations")
                .tag("operator", operatorTag)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param operatorTag operator tag, or {@link #UNKNOWN_OPERATOR}
     * @param error failure kind
     */
    public void incrementFailure(String operatorTag, EvaluationError error) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of rejected evaluations")
                .tag("operator", operatorTag)
                .tag("reason", error.code())
                .register(registry)
                .increment();
    }
}
