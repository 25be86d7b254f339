package ca.gc.cra.layeredconfig.domain.error;

import java.util.List;

/**
 * Raised when a write names a key that no source has a value or type declaration for, and no explicit target source
 * was given. Keys are never created implicitly in an arbitrary backend.
 *
 * @since 0.1.0
 */
public class WriteTargetUnresolvableException extends ConfigKeyNotFoundException {
  private static final long serialVersionUID = 1L;

  public WriteTargetUnresolvableException(List<String> path, String key) {
    super(path, key, "cannot set " + describe(path, key)
        + ": no source defines it; name a target source to create it");
  }
}
