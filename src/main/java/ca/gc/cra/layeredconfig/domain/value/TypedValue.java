package ca.gc.cra.layeredconfig.domain.value;

import ca.gc.cra.layeredconfig.domain.error.ConfigCoercionException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Result of a configuration lookup: a value plus its resolved {@link ValueKind}.
 * <p><strong>Why:</strong> Separates resolution from consumption; typed accessors dispatch on the tag and fail loudly on
 * a mismatch instead of silently casting.</p>
 * <p><strong>Thread-safety:</strong> Immutable when the wrapped value is immutable (lists are copied on creation).</p>
 *
 * @param value resolved value; {@code null} for a present-but-empty setting
 * @param kind semantic kind of {@code value}
 * @since 0.1.0
 */
public record TypedValue(Object value, ValueKind kind) {

  public TypedValue {
    Objects.requireNonNull(kind, "kind");
    if (value instanceof List<?> list) {
      value = List.copyOf(list);
    }
  }

  /**
   * Wraps a native value, inferring its kind.
   *
   * @param value native value; {@code null} is tagged {@link ValueKind#STRING}
   * @return typed value
   * @throws IllegalArgumentException when the value type is not supported
   */
  public static TypedValue of(Object value) {
    if (value == null) {
      return new TypedValue(null, ValueKind.STRING);
    }
    return new TypedValue(TypeCoercion.normalize(value), TypeCoercion.kindOf(value));
  }

  /** Returns {@code true} when the setting is present but carries no value. */
  public boolean isNull() {
    return value == null;
  }

  /**
   * Returns the value as text; every leaf kind has a canonical string form.
   *
   * @return string value, or {@code null} for an empty setting
   */
  public String asString() {
    if (kind == ValueKind.SECTION) {
      throw mismatch(ValueKind.STRING);
    }
    return value == null ? null : TypeCoercion.toRaw(value);
  }

  /** Returns the value as a {@code long}; requires {@link ValueKind#INTEGER}. */
  public long asLong() {
    return ((Long) require(ValueKind.INTEGER));
  }

  /** Returns the value as a {@code boolean}; requires {@link ValueKind#BOOLEAN}. */
  public boolean asBoolean() {
    return ((Boolean) require(ValueKind.BOOLEAN));
  }

  /** Returns the value as a list of strings; requires {@link ValueKind#LIST}. */
  public List<String> asList() {
    Collection<?> items = (Collection<?>) require(ValueKind.LIST);
    List<String> texts = new ArrayList<>(items.size());
    for (Object item : items) {
      texts.add(item == null ? "" : TypeCoercion.toRaw(item));
    }
    return List.copyOf(texts);
  }

  /** Returns the value as a date; requires {@link ValueKind#DATE}. */
  public LocalDate asDate() {
    return (LocalDate) require(ValueKind.DATE);
  }

  /** Returns the value as a date-time; requires {@link ValueKind#DATETIME}. */
  public LocalDateTime asDateTime() {
    return (LocalDateTime) require(ValueKind.DATETIME);
  }

  private Object require(ValueKind wanted) {
    if (kind != wanted || value == null) {
      throw mismatch(wanted);
    }
    return value;
  }

  private ConfigCoercionException mismatch(ValueKind wanted) {
    return new ConfigCoercionException(
        "value of kind " + kind + (value == null ? " (empty)" : "") + " cannot be read as " + wanted);
  }
}
