package ca.gc.cra.layeredconfig.domain.value;

/**
 * <strong>What:</strong> Semantic type tag attached to every resolved configuration value.
 * <p><strong>Why:</strong> Backends disagree on typing; the tag lets callers dispatch on a closed set of kinds instead
 * of inspecting runtime classes.</p>
 * <p><strong>Role:</strong> Domain enumeration shared by coercion, sources, the resolver, and the façade.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 * @see TypedValue
 * @see TypeCoercion
 */
public enum ValueKind {
  /** Plain text; the fallback for untyped backends. */
  STRING,
  /** Base-10 integral number, held as {@link Long}. */
  INTEGER,
  /** {@code True}/{@code False}. */
  BOOLEAN,
  /** Ordered list of strings. */
  LIST,
  /** Calendar date ({@code YYYY-MM-DD}). */
  DATE,
  /** Local date and time ({@code YYYY-MM-DD HH:MM:SS}). */
  DATETIME,
  /** Nested subsection; the value is a nested configuration view. */
  SECTION
}
