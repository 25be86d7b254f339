/**
 * <strong>Purpose:</strong> Ports implemented by configuration backends.
 * <p><strong>Role:</strong> Infrastructure adapters (defaults, files, environment, command line) implement
 * {@link ca.gc.cra.layeredconfig.application.port.ConfigSource}; the resolver consumes it.</p>
 * <p><strong>Concurrency:</strong> Implementations assume single-threaded use.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.layeredconfig.application.port;
