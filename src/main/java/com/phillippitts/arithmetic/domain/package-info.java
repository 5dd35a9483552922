/**
 * Domain models for the calculator.
 *
 * <p>All domain types are immutable and request-scoped:
 * <ul>
 *   <li>{@link com.phillippitts.arithmetic.domain.Operator} - closed set of operators
 *       ({@code add}, {@code sub}, {@code mul}, {@code div}) with tag parsing</li>
 *   <li>{@link com.phillippitts.arithmetic.domain.CalculationResult} - the
 *       {@code (a, b, operator, result)} tuple returned to callers</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.domain;
