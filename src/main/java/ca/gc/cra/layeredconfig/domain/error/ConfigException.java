package ca.gc.cra.layeredconfig.domain.error;

/**
 * Base type for configuration resolution failures surfaced to callers.
 *
 * @since 0.1.0
 */
public class ConfigException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
