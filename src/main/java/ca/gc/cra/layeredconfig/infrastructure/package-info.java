/**
 * <strong>Purpose:</strong> Adapters that turn external configuration representations into
 * {@link ca.gc.cra.layeredconfig.application.port.ConfigSource}s.
 *
 * @since 0.1.0
 */
package ca.gc.cra.layeredconfig.infrastructure;
