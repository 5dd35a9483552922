package com.phillippitts.arithmetic.presentation.dto;

import jakarta.validation.constraints.NotNull;

/**
 * JSON request body carrying the two operands, e.g. {@code {"a": 3, "b": 5}}.
 *
 * <p>Finiteness is not checked here; the evaluator rejects Inf/NaN itself.
 */
public record OperandsRequest(
        @NotNull(message = "Operand 'a' is required")
        Double a,

        @NotNull(message = "Operand 'b' is required")
        Double b
) {
}
