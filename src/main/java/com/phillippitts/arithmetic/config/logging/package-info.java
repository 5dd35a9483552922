/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>{@link com.phillippitts.arithmetic.config.logging.MdcFilter} injects {@code requestId},
 * {@code method} and {@code uri} into the Log4j2 ThreadContext for every HTTP request.
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [thread-name] [requestId] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.config.logging;
