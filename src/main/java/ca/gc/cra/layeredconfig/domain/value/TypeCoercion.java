package ca.gc.cra.layeredconfig.domain.value;

import ca.gc.cra.layeredconfig.domain.error.ConfigCoercionException;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Pure conversions between untyped configuration text and the supported {@link ValueKind}s.
 * <p><strong>Why:</strong> INI files, environment variables, and most command lines carry only strings; the resolver
 * recovers their semantic type from hints declared elsewhere.</p>
 * <p><strong>Role:</strong> Domain support used by the resolver, text-based sources on write, and as converters for
 * configured command lines.</p>
 * <p><strong>Encodings:</strong>
 * <ul>
 *   <li>boolean: case-insensitive {@code true}/{@code false}; serialized as {@code True}/{@code False}</li>
 *   <li>integer: base-10, held as {@link Long}</li>
 *   <li>list: comma separated, serialized as {@code a, b, c}</li>
 *   <li>date: {@code YYYY-MM-DD}</li>
 *   <li>datetime: {@code YYYY-MM-DD HH:MM:SS} (an ISO {@code T} separator is accepted on parse)</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class TypeCoercion {
  private static final Pattern LIST_SEPARATOR = Pattern.compile(",\\s*");
  private static final DateTimeFormatter DATETIME_OUT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final DateTimeFormatter DATETIME_IN = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE)
      .appendLiteral(' ')
      .append(DateTimeFormatter.ISO_LOCAL_TIME)
      .toFormatter(Locale.ROOT);

  private TypeCoercion() {
    // Utility
  }

  /**
   * Infers the kind of a native value.
   *
   * @param value native value; must not be {@code null}
   * @return matching kind
   * @throws IllegalArgumentException if the value type is not supported
   */
  public static ValueKind kindOf(Object value) {
    Objects.requireNonNull(value, "value");
    if (value instanceof String) {
      return ValueKind.STRING;
    }
    if (value instanceof Boolean) {
      return ValueKind.BOOLEAN;
    }
    if (isIntegral(value)) {
      return ValueKind.INTEGER;
    }
    if (value instanceof Collection<?>) {
      return ValueKind.LIST;
    }
    if (value instanceof LocalDateTime) {
      return ValueKind.DATETIME;
    }
    if (value instanceof LocalDate) {
      return ValueKind.DATE;
    }
    throw new IllegalArgumentException("unsupported configuration value type: " + value.getClass().getName());
  }

  /**
   * Maps a type token to a kind, as used by type placeholders.
   *
   * @param type type token such as {@code Integer.class}
   * @return matching kind
   * @throws IllegalArgumentException if the token maps to no supported kind
   */
  public static ValueKind kindOf(Class<?> type) {
    Objects.requireNonNull(type, "type");
    if (type == String.class || type == CharSequence.class) {
      return ValueKind.STRING;
    }
    if (type == Boolean.class || type == boolean.class) {
      return ValueKind.BOOLEAN;
    }
    if (type == Long.class || type == long.class || type == Integer.class || type == int.class
        || type == Short.class || type == short.class || type == BigInteger.class) {
      return ValueKind.INTEGER;
    }
    if (List.class.isAssignableFrom(type) || type == Collection.class) {
      return ValueKind.LIST;
    }
    if (type == LocalDateTime.class) {
      return ValueKind.DATETIME;
    }
    if (type == LocalDate.class) {
      return ValueKind.DATE;
    }
    throw new IllegalArgumentException("unsupported configuration type token: " + type.getName());
  }

  /**
   * Converts a native value to its canonical Java representation: integral numbers become {@link Long} and
   * collections become unmodifiable string lists.
   *
   * @param value native value; {@code null} is returned unchanged
   * @return canonical value
   * @throws ConfigCoercionException if an integral value does not fit in a {@code long}
   */
  public static Object normalize(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof BigInteger big) {
      try {
        return big.longValueExact();
      } catch (ArithmeticException ex) {
        throw new ConfigCoercionException("integer " + big + " is outside the supported range", ex);
      }
    }
    if (isIntegral(value)) {
      return ((Number) value).longValue();
    }
    if (value instanceof Collection<?> collection) {
      List<String> items = new ArrayList<>(collection.size());
      for (Object item : collection) {
        items.add(item == null ? "" : toRaw(item));
      }
      return List.copyOf(items);
    }
    return value;
  }

  /**
   * Parses raw text into the requested kind.
   *
   * @param raw untyped text; {@code null} stays {@code null}
   * @param kind wanted kind
   * @return typed value
   * @throws ConfigCoercionException if the text is malformed for {@code kind}
   */
  public static Object toTyped(String raw, ValueKind kind) {
    Objects.requireNonNull(kind, "kind");
    if (raw == null) {
      return null;
    }
    return switch (kind) {
      case STRING -> raw;
      case INTEGER -> toInteger(raw);
      case BOOLEAN -> toBoolean(raw);
      case LIST -> toList(raw);
      case DATE -> toDate(raw);
      case DATETIME -> toDateTime(raw);
      case SECTION -> throw new ConfigCoercionException("a subsection has no scalar representation");
    };
  }

  /**
   * Serializes a typed value into the canonical text encoding.
   *
   * @param value typed value; must not be {@code null}
   * @return string encoding
   */
  public static String toRaw(Object value) {
    Objects.requireNonNull(value, "value");
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof Boolean flag) {
      return flag ? "True" : "False";
    }
    if (value instanceof Collection<?> collection) {
      List<String> parts = new ArrayList<>(collection.size());
      for (Object item : collection) {
        parts.add(item == null ? "" : toRaw(item));
      }
      return String.join(", ", parts);
    }
    if (value instanceof LocalDateTime dateTime) {
      return dateTime.getNano() == 0
          ? DATETIME_OUT.format(dateTime)
          : DATETIME_IN.format(dateTime);
    }
    return value.toString();
  }

  /**
   * Parses a boolean literal.
   *
   * @param raw text; {@code true}/{@code false} in any case
   * @return parsed flag
   * @throws ConfigCoercionException for any other text
   */
  public static Boolean toBoolean(String raw) {
    if (!isBooleanLiteral(raw)) {
      throw new ConfigCoercionException("'" + raw + "' is not a boolean (expected True or False)");
    }
    return Boolean.parseBoolean(raw.trim());
  }

  /**
   * Returns whether the text is a boolean literal accepted by {@link #toBoolean(String)}.
   *
   * @param raw text, may be {@code null}
   * @return {@code true} for {@code true}/{@code false} in any case
   */
  public static boolean isBooleanLiteral(String raw) {
    if (raw == null) {
      return false;
    }
    String trimmed = raw.trim();
    return "true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed);
  }

  /**
   * Parses a base-10 integer.
   *
   * @param raw decimal text
   * @return parsed value
   * @throws ConfigCoercionException when the text is not a decimal integer
   */
  public static Long toInteger(String raw) {
    try {
      return Long.parseLong(Objects.requireNonNull(raw, "raw").trim());
    } catch (NumberFormatException ex) {
      throw new ConfigCoercionException("'" + raw + "' is not an integer", ex);
    }
  }

  /**
   * Splits comma separated text into a list; blank text yields an empty list.
   *
   * @param raw comma separated text
   * @return unmodifiable list of trimmed items
   */
  public static List<String> toList(String raw) {
    String trimmed = Objects.requireNonNull(raw, "raw").trim();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    return List.of(LIST_SEPARATOR.split(trimmed));
  }

  /**
   * Parses a {@code YYYY-MM-DD} date.
   *
   * @param raw date text
   * @return parsed date
   * @throws ConfigCoercionException when the text is not an ISO date
   */
  public static LocalDate toDate(String raw) {
    try {
      return LocalDate.parse(Objects.requireNonNull(raw, "raw").trim());
    } catch (DateTimeParseException ex) {
      throw new ConfigCoercionException("'" + raw + "' is not a date (expected YYYY-MM-DD)", ex);
    }
  }

  /**
   * Parses a {@code YYYY-MM-DD HH:MM:SS} date-time; an ISO {@code T} separator and fractional seconds are accepted.
   *
   * @param raw date-time text
   * @return parsed date-time
   * @throws ConfigCoercionException when the text is not a date-time
   */
  public static LocalDateTime toDateTime(String raw) {
    String trimmed = Objects.requireNonNull(raw, "raw").trim();
    if (trimmed.length() > 10 && (trimmed.charAt(10) == 'T' || trimmed.charAt(10) == 't')) {
      trimmed = trimmed.substring(0, 10) + ' ' + trimmed.substring(11);
    }
    try {
      return LocalDateTime.parse(trimmed, DATETIME_IN);
    } catch (DateTimeParseException ex) {
      throw new ConfigCoercionException(
          "'" + raw + "' is not a date-time (expected YYYY-MM-DD HH:MM:SS)", ex);
    }
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Long || value instanceof Integer || value instanceof Short
        || value instanceof Byte || value instanceof BigInteger;
  }
}
