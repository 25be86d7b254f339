/**
 * Unchecked exception taxonomy for configuration lookups and writes.
 * <p>{@link ca.gc.cra.layeredconfig.domain.error.ConfigKeyNotFoundException} covers missing keys and unresolvable write
 * targets; {@link ca.gc.cra.layeredconfig.domain.error.ConfigCoercionException} covers malformed text. Missing or
 * unreadable files are not errors: sources recover them as empty, writable backends.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.layeredconfig.domain.error;
