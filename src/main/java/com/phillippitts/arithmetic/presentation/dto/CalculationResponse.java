package com.phillippitts.arithmetic.presentation.dto;

import com.phillippitts.arithmetic.domain.CalculationResult;

/**
 * Success payload: {@code {"a": 3.0, "b": 5.0, "operator": "add", "result": 8.0}}.
 */
public record CalculationResponse(double a, double b, String operator, double result) {

    public static CalculationResponse from(CalculationResult result) {
        return new CalculationResponse(result.a(), result.b(), result.operator().tag(), result.result());
    }
}
