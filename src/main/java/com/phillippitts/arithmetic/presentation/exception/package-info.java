/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.arithmetic.exception.InvalidOperandException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.arithmetic.exception.UndefinedOperationException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.arithmetic.exception.UnsupportedOperatorException} → 400 Bad Request</li>
 *   <li>Missing/mismatched parameters, unreadable or invalid bodies → 400 Bad Request</li>
 *   <li>Other Spring {@code ErrorResponse} exceptions → their own status (404, 405, ...)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "UndefinedOperationException",
 *   "message": "Division by zero",
 *   "details": "Operation 'div' is undefined: cannot divide by zero",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @see com.phillippitts.arithmetic.exception
 * @since 1.0
 */
package com.phillippitts.arithmetic.presentation.exception;
