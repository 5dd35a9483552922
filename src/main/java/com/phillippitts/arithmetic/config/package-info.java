/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.arithmetic.config.WebCorsConfig} - CORS mapping for all endpoints</li>
 *   <li>{@link com.phillippitts.arithmetic.config.properties.CalculatorProperties} - typed
 *       {@code calculator.*} settings</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - validated {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.arithmetic.config;
