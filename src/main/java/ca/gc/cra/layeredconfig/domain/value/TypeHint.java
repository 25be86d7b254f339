package ca.gc.cra.layeredconfig.domain.value;

import java.util.Objects;

/**
 * Type placeholder declaring the expected kind of a key without supplying a value.
 *
 * <p>A default such as {@code Map.of("processes", TypeHint.of(ValueKind.INTEGER))} (or the equivalent type token
 * {@code Integer.class}) is never readable itself. It only drives coercion of string values that other sources supply
 * for the same key.</p>
 *
 * @param kind declared kind; never {@link ValueKind#SECTION}
 * @since 0.1.0
 */
public record TypeHint(ValueKind kind) {

  public TypeHint {
    Objects.requireNonNull(kind, "kind");
    if (kind == ValueKind.SECTION) {
      throw new IllegalArgumentException("a subsection cannot be declared as a type placeholder");
    }
  }

  /**
   * Creates a placeholder for the given kind.
   *
   * @param kind declared kind
   * @return placeholder
   */
  public static TypeHint of(ValueKind kind) {
    return new TypeHint(kind);
  }

  /**
   * Creates a placeholder from a Java type token such as {@code Integer.class} or {@code LocalDate.class}.
   *
   * @param type type token
   * @return placeholder for the matching kind
   * @throws IllegalArgumentException when the token maps to no supported kind
   */
  public static TypeHint of(Class<?> type) {
    return new TypeHint(TypeCoercion.kindOf(type));
  }
}
