package ca.gc.cra.layeredconfig.domain.error;

/**
 * Raised when raw text cannot be parsed as the kind declared or inferred for its key, or when a typed accessor is used
 * on a value of another kind. Propagated at the point of access; malformed input never falls back to a string.
 *
 * @since 0.1.0
 */
public class ConfigCoercionException extends ConfigException {
  private static final long serialVersionUID = 1L;

  public ConfigCoercionException(String message) {
    super(message);
  }

  public ConfigCoercionException(String message, Throwable cause) {
    super(message, cause);
  }
}
