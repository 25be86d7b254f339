package ca.gc.cra.layeredconfig.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for configuration key names, subsection names, and prefixes.
 * <p><strong>Why:</strong> Keys arrive from files, environment variables, and command lines; rejecting blank or
 * control-character names up front keeps every backend's key space consistent.</p>
 * <p><strong>Role:</strong> Support utilities invoked by the façade and the sources before touching storage.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a key or subsection name used verbatim as a lookup key.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate key; must not be {@code null}
   * @return the unchanged key
   * @throws IllegalArgumentException if the key is blank, padded with whitespace, or contains control characters
   */
  public static String requireKey(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!trimmed.equals(value)) {
      throw new IllegalArgumentException(message(name, "must not have leading or trailing whitespace"));
    }
    return value;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
