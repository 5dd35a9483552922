/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@link com.phillippitts.arithmetic.presentation.controller.DiscoveryController}
 *       - greeting ({@code GET /}) and liveness ({@code GET /health})</li>
 *   <li>{@link com.phillippitts.arithmetic.presentation.controller.CalculatorController}
 *       - {@code GET /calc}, {@code POST /calc/{op}} and the {@code POST /add|sub|mul|div} shortcuts</li>
 * </ul>
 *
 * <p>Controllers extract parameters, delegate to {@code CalculationService}, and let
 * {@code GlobalExceptionHandler} handle exceptions.
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.presentation.controller;
