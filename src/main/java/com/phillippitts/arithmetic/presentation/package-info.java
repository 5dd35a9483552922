/**
 * Presentation layer (REST API controllers, DTOs and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.dto} - request/response records</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; business logic lives in services. Controllers never throw
 * HTTP-specific exceptions.
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.presentation;
