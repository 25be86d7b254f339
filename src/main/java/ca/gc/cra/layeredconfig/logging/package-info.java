/**
 * <strong>Purpose:</strong> Logging utilities that sanitize configuration values before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Observability:</strong> Coordinates with SLF4J; the binding (Logback in tests) is chosen by the
 * application.</p>
 * <p><strong>Security:</strong> Redacts values of secret-looking keys.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.layeredconfig.logging;
