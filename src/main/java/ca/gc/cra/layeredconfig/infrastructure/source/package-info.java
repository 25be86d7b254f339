/**
 * In-memory sources: code defaults, environment variables, and command-line arguments, plus the shared map-tree base
 * {@link ca.gc.cra.layeredconfig.infrastructure.source.TreeConfigSource}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.layeredconfig.infrastructure.source;
