/**
 * Arithmetic evaluation core.
 *
 * <p>{@link com.phillippitts.arithmetic.service.evaluation.ArithmeticEvaluator} is a pure function of
 * {@code (a, b, operator)}: it rejects non-finite operands, unknown operator tags and division by
 * exact zero, and otherwise returns {@code a + b}, {@code a - b}, {@code a * b} or {@code a / b}.
 * Failures come back as a {@link com.phillippitts.arithmetic.service.evaluation.Evaluation} carrying
 * the typed exception, never as an uncaught fault.
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.service.evaluation;
