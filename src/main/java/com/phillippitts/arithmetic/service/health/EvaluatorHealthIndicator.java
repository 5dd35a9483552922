package com.phillippitts.arithmetic.service.health;

import com.phillippitts.arithmetic.domain.Operator;
import com.phillippitts.arithmetic.service.evaluation.ArithmeticEvaluator;
import com.phillippitts.arithmetic.service.evaluation.Evaluation;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator that runs a fixed self-check through the evaluator:
 * <ul>
 *   <li>{@code 3 add 5} yields 8</li>
 *   <li>{@code 10 div 4} yields 2.5</li>
 *   <li>{@code 1 div 0} is rejected</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health. The plain {@code /health} liveness endpoint does not use it.
 */
@Component
public class EvaluatorHealthIndicator implements HealthIndicator {

    private final ArithmeticEvaluator evaluator;

    public EvaluatorHealthIndicator(ArithmeticEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public Health health() {
        boolean addOk = yields(evaluator.evaluate(3, 5, Operator.ADD), 8);
        boolean divOk = yields(evaluator.evaluate(10, 4, Operator.DIV), 2.5);
        boolean zeroRejected = !evaluator.evaluate(1, 0, Operator.DIV).isSuccess();

        Health.Builder builder = (addOk && divOk && zeroRejected) ? Health.up() : Health.down();
        return builder
                .withDetail("add", formatStatus(addOk))
                .withDetail("div", formatStatus(divOk))
                .withDetail("divByZero", zeroRejected ? "rejected" : "NOT rejected")
                .build();
    }

    private static boolean yields(Evaluation evaluation, double expected) {
        return evaluation.isSuccess() && evaluation.result().result() == expected;
    }

    private static String formatStatus(boolean ok) {
        return ok ? "ok" : "wrong result";
    }
}
