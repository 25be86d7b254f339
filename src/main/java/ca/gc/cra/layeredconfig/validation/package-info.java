/**
 * <strong>Purpose:</strong> Input validation for key names, subsection names, and environment prefixes.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.</p>
 * <p><strong>Security:</strong> Rejects control characters before names reach file writers.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.layeredconfig.validation;
