package ca.gc.cra.layeredconfig.infrastructure.source;

import ca.gc.cra.layeredconfig.domain.value.TypeCoercion;
import java.time.LocalDate;
import java.time.LocalDateTime;
import picocli.CommandLine.ITypeConverter;

/**
 * picocli converters for the canonical text encodings, for use in {@code @Option(converter = ...)} or
 * {@code OptionSpec.Builder#converters}.
 *
 * @since 0.1.0
 */
public final class CommandLineConverters {

  private CommandLineConverters() {
    // Utility
  }

  /** Accepts {@code true}/{@code false} in any case; pair with {@code arity = "0..1", fallbackValue = "true"}. */
  public static final class BooleanConverter implements ITypeConverter<Boolean> {
    @Override
    public Boolean convert(String value) {
      return TypeCoercion.toBoolean(value);
    }
  }

  /** Accepts {@code YYYY-MM-DD}. */
  public static final class DateConverter implements ITypeConverter<LocalDate> {
    @Override
    public LocalDate convert(String value) {
      return TypeCoercion.toDate(value);
    }
  }

  /** Accepts {@code YYYY-MM-DD HH:MM:SS} or the ISO {@code T} form. */
  public static final class DateTimeConverter implements ITypeConverter<LocalDateTime> {
    @Override
    public LocalDateTime convert(String value) {
      return TypeCoercion.toDateTime(value);
    }
  }
}
