/**
 * <strong>Purpose:</strong> Public façade over a layered configuration tree.
 * <p><strong>Role:</strong> {@link ca.gc.cra.layeredconfig.api.LayeredConfig} is what applications hold; sources are
 * built from {@code ca.gc.cra.layeredconfig.infrastructure.source} and passed in priority order.</p>
 * <p><strong>Concurrency:</strong> Single-threaded use is assumed.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.layeredconfig.api;
