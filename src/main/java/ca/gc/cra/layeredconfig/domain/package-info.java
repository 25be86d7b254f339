/**
 * Core domain model for layered configuration resolution.
 * <p><strong>Role:</strong> Domain layer describing typed values, type placeholders, and the error taxonomy without
 * any dependency on concrete configuration backends.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; the configuration tree itself assumes
 * single-threaded use.</p>
 * <p><strong>Security:</strong> Values may carry credentials; callers route log output through
 * {@code ca.gc.cra.layeredconfig.logging.Logs}.</p>
 */
package ca.gc.cra.layeredconfig.domain;
