package ca.gc.cra.layeredconfig.application.port;

import ca.gc.cra.layeredconfig.domain.error.ConfigKeyNotFoundException;
import ca.gc.cra.layeredconfig.domain.value.TypeHint;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for one ranked configuration backend (defaults, a file, the environment, or the command
 * line) scoped to a single subsection.
 * <p><strong>Why:</strong> Lets the resolver merge heterogeneous, partially-typed backends through one contract and
 * explicit capability flags instead of probing with exceptions.</p>
 * <p><strong>Role:</strong> Input port consumed by {@code ca.gc.cra.layeredconfig.application.resolve.Resolver}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose leaf keys and child subsections of the current node in source order.</li>
 *   <li>Report whether a key carries native typing or a type placeholder.</li>
 *   <li>Accept writes and persist them, all-or-nothing, when dirty.</li>
 * </ul>
 * <p><strong>Invariant:</strong> within one source a name is either a leaf key or a subsection, never both.</p>
 * <p><strong>Thread-safety:</strong> Implementations assume single-threaded use.</p>
 *
 * @since 0.1.0
 */
public interface ConfigSource {

  /**
   * Stable identifier naming the backend kind (for example {@code inifile}); used by explicit-target writes.
   *
   * @return identifier, identical for every subsection view of one source
   */
  String identifier();

  /**
   * Whether subsections may nest deeper than one level.
   *
   * @return {@code false} for flat two-level backends such as INI files
   */
  boolean supportsNesting();

  /**
   * Whether the backend can carry type information for at least some keys.
   *
   * @return {@code false} when every value is plain text
   */
  boolean carriesTypes();

  /**
   * Whether the backend has persistent storage that accepts writes; such sources are preferred as write targets.
   *
   * @return {@code true} for file-backed sources
   */
  boolean writable();

  /**
   * Returns the leaf keys that hold a value directly at this node, in source order. Type placeholders are excluded.
   *
   * @return leaf key names; never {@code null}
   */
  List<String> keys();

  /**
   * Returns the names of direct child subsections, in source order.
   *
   * @return subsection names; never {@code null}
   */
  List<String> subsections();

  /**
   * Returns whether the key holds a value (possibly {@code null}) at this node.
   *
   * @param key leaf key
   * @return {@code true} when {@link #get(String)} succeeds
   */
  boolean has(String key);

  /**
   * Returns whether the backend itself carries type information for the key, either through a native value or a type
   * placeholder.
   *
   * @param key leaf key
   * @return {@code true} when {@link #typeHint(String)} is present
   */
  default boolean typed(String key) {
    return typeHint(key).isPresent();
  }

  /**
   * Returns the kind the backend declares for the key.
   *
   * @param key leaf key
   * @return declared kind, or empty when the key is absent or untyped
   */
  Optional<TypeHint> typeHint(String key);

  /**
   * Returns the most specific representation of the key's value: the native value when the backend carries typing,
   * otherwise its text.
   *
   * @param key leaf key
   * @return value, possibly {@code null} for a present-but-empty setting
   * @throws ConfigKeyNotFoundException when the key holds no value at this node
   */
  Object get(String key);

  /**
   * Returns a view over a child subsection, creating no storage until a write lands in it.
   *
   * @param name subsection name
   * @return subsection view sharing this source's storage and dirty state
   */
  ConfigSource subsection(String name);

  /**
   * Stores a value at this node. Untyped backends store the canonical text encoding. Marks the source dirty.
   *
   * @param key leaf key
   * @param value typed value, or {@code null}
   */
  void set(String key, Object value);

  /**
   * Returns whether the source holds writes not yet persisted.
   *
   * @return dirty flag of the whole source
   */
  boolean dirty();

  /**
   * Persists the whole source when dirty; a no-op otherwise or when the backend has nowhere to persist to.
   *
   * @throws IOException if the backing store cannot be written
   */
  void write() throws IOException;
}
