/**
 * <strong>Purpose:</strong> The resolution engine: precedence, cascading, type recovery, and write routing across an
 * ordered list of {@link ca.gc.cra.layeredconfig.application.port.ConfigSource}s.
 * <p><strong>Concurrency:</strong> Not thread-safe; computations run on demand against live source contents.</p>
 * <p><strong>Observability:</strong> Logs resolution and write-routing decisions at DEBUG through SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.layeredconfig.application.resolve;
