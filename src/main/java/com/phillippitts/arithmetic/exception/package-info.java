/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.arithmetic.exception.CalculatorException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.arithmetic.exception.EvaluationException} - Caller-input
 *       failure carrying an {@link com.phillippitts.arithmetic.exception.EvaluationError} kind
 *     <ul>
 *       <li>{@link com.phillippitts.arithmetic.exception.InvalidOperandException} - operand is
 *           infinite or NaN</li>
 *       <li>{@link com.phillippitts.arithmetic.exception.UndefinedOperationException} - division
 *           by exact zero</li>
 *       <li>{@link com.phillippitts.arithmetic.exception.UnsupportedOperatorException} - operator
 *           tag outside the closed set</li>
 *     </ul>
 *   </li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP 400 via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.arithmetic.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.arithmetic.exception;
