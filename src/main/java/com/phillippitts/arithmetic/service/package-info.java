/**
 * Service layer.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.evaluation} - pure arithmetic evaluator and its result type</li>
 *   <li>{@code service.calculation} - controller-facing service adding logging and metrics</li>
 *   <li>{@code service.metrics} - Micrometer counters</li>
 *   <li>{@code service.health} - Actuator health indicator</li>
 * </ul>
 *
 * <p>Services are stateless Spring beans using constructor injection, throw domain exceptions
 * (never HTTP exceptions) and are safe for concurrent requests.
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.service;
