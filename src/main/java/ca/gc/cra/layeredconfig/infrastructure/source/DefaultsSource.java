package ca.gc.cra.layeredconfig.infrastructure.source;

import ca.gc.cra.layeredconfig.domain.value.TypeCoercion;
import ca.gc.cra.layeredconfig.domain.value.TypeHint;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> In-memory, fully typed source holding the application's code defaults.
 * <p><strong>Why:</strong> Defaults declare both fallback values and, through type placeholders, the expected kind of
 * settings that only untyped sources supply.</p>
 * <p><strong>Role:</strong> Lowest-priority adapter in most stacks. Nested maps become subsections; a {@link Class}
 * token or {@link TypeHint} value becomes a placeholder; {@code null} is a present-but-empty value.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsSource extends TreeConfigSource {
  /** Identifier used for explicit-target writes. */
  public static final String IDENTIFIER = "defaults";

  /**
   * Creates a defaults source. The map is copied.
   *
   * @param defaults keys mapped to values, nested maps, type tokens, or {@link TypeHint}s
   * @throws IllegalArgumentException if a value or type token is not a supported kind
   */
  public DefaultsSource(Map<String, ?> defaults) {
    super(IDENTIFIER);
    Objects.requireNonNull(defaults, "defaults");
    load(declare(defaults));
  }

  @Override
  public boolean carriesTypes() {
    return true;
  }

  @Override
  public boolean writable() {
    return false;
  }

  @Override
  protected boolean isTypedValue(Object value) {
    return true;
  }

  private static Map<String, Object> declare(Map<?, ?> input) {
    Map<String, Object> declared = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : input.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException("default keys must be strings (was " + entry.getKey() + ")");
      }
      declared.put(key, declareValue(entry.getValue()));
    }
    return declared;
  }

  private static Object declareValue(Object value) {
    if (value == null || value instanceof TypeHint) {
      return value;
    }
    if (value instanceof Map<?, ?> nested) {
      return declare(nested);
    }
    if (value instanceof Class<?> type) {
      return TypeHint.of(type);
    }
    Object normalized = TypeCoercion.normalize(value);
    // rejects unsupported value types up front
    TypeCoercion.kindOf(normalized);
    return normalized;
  }
}
