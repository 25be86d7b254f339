package ca.gc.cra.layeredconfig.domain.error;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Raised when a key has no value in any source, directly or through cascading.
 * <p><strong>Why:</strong> Missing settings are never silently mapped to {@code null}; callers that treat a setting as
 * optional use an explicit-default read instead.</p>
 *
 * @since 0.1.0
 */
public class ConfigKeyNotFoundException extends ConfigException {
  private static final long serialVersionUID = 1L;

  private final List<String> path;
  private final String key;

  /**
   * Creates the exception for a key at a subsection path.
   *
   * @param path subsection path from the root; empty for root keys
   * @param key missing key
   */
  public ConfigKeyNotFoundException(List<String> path, String key) {
    this(path, key, "no configuration value for " + describe(path, key));
  }

  protected ConfigKeyNotFoundException(List<String> path, String key, String message) {
    super(message);
    this.path = List.copyOf(Objects.requireNonNull(path, "path"));
    this.key = Objects.requireNonNull(key, "key");
  }

  /** Subsection path of the missing key. */
  public List<String> path() {
    return path;
  }

  /** Name of the missing key. */
  public String key() {
    return key;
  }

  static String describe(List<String> path, String key) {
    return path.isEmpty() ? "'" + key + "'" : "'" + String.join(".", path) + "." + key + "'";
  }
}
