package ca.gc.cra.layeredconfig.application.resolve;

import ca.gc.cra.layeredconfig.application.port.ConfigSource;
import ca.gc.cra.layeredconfig.domain.error.ConfigCoercionException;
import ca.gc.cra.layeredconfig.domain.error.ConfigKeyNotFoundException;
import ca.gc.cra.layeredconfig.domain.error.WriteTargetUnresolvableException;
import ca.gc.cra.layeredconfig.domain.value.TypeCoercion;
import ca.gc.cra.layeredconfig.domain.value.TypeHint;
import ca.gc.cra.layeredconfig.domain.value.TypedValue;
import ca.gc.cra.layeredconfig.domain.value.ValueKind;
import ca.gc.cra.layeredconfig.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Merges an ordered list of {@link ConfigSource}s into one logical configuration tree.
 * <p><strong>Why:</strong> Backends differ in typing, nesting depth, and writability; the resolver reconciles them into
 * a single read/write model with fixed precedence and coercion rules.</p>
 * <p><strong>Role:</strong> Shared root of one configuration tree. Every subsection view holds this instance plus its
 * own path; the resolver itself stores nothing but the source list and the cascade flag.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Sources are ordered lowest to highest priority; reads scan from the highest.</li>
 *   <li>The first source holding a value wins. Type placeholders are never values.</li>
 *   <li>With cascade enabled, a subsection inherits keys it lacks from its ancestors.</li>
 *   <li>Untyped text is coerced using the first type hint found, highest priority first.</li>
 *   <li>Writes land in exactly one source: an explicitly named one, else the highest-priority source that already
 *       knows the key, unless a writable source ranks above it.</li>
 *   <li>Key listings name each setting once; a case-insensitive source adds no second spelling of a listed key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; single-threaded use is assumed.</p>
 *
 * @since 0.1.0
 */
public final class Resolver {
  private static final Logger log = LoggerFactory.getLogger(Resolver.class);

  private final List<ConfigSource> sources;
  private final boolean cascade;

  /**
   * Creates a resolver over the given sources.
   *
   * @param sources sources ordered from lowest to highest priority; the list is copied, the sources are shared
   * @param cascade whether subsections inherit unset keys from their ancestors
   */
  public Resolver(List<? extends ConfigSource> sources, boolean cascade) {
    Objects.requireNonNull(sources, "sources");
    for (ConfigSource source : sources) {
      Objects.requireNonNull(source, "source");
    }
    this.sources = List.copyOf(sources);
    this.cascade = cascade;
  }

  /** Sources ordered from lowest to highest priority. */
  public List<ConfigSource> sources() {
    return sources;
  }

  /** Whether subsections inherit unset keys from their ancestors. */
  public boolean cascade() {
    return cascade;
  }

  /**
   * Resolves a leaf key at a subsection path into a typed value.
   *
   * @param path subsection path from the root; empty for the root
   * @param key leaf key
   * @return resolved value and kind
   * @throws ConfigKeyNotFoundException if no source holds a value for the key
   * @throws ConfigCoercionException if the winning text is malformed for the hinted kind
   */
  public TypedValue resolve(List<String> path, String key) {
    return find(path, key).orElseThrow(() -> new ConfigKeyNotFoundException(path, key));
  }

  /**
   * Resolves a leaf key, returning empty instead of failing when it has no value.
   *
   * @param path subsection path from the root
   * @param key leaf key
   * @return resolved value, or empty when absent
   * @throws ConfigCoercionException if the winning text is malformed for the hinted kind
   */
  public Optional<TypedValue> find(List<String> path, String key) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(key, "key");
    Optional<Hit> hit = findValue(path, key);
    if (hit.isEmpty()) {
      return Optional.empty();
    }
    Hit found = hit.get();
    TypedValue resolved = typed(path, key, found);
    if (log.isDebugEnabled()) {
      log.debug("Resolved {} from {} as {} ({})", display(path, key), found.source().identifier(),
          Logs.describe(key, resolved.value()), resolved.kind());
    }
    return Optional.of(resolved);
  }

  /**
   * Returns whether a leaf key resolves to a value at the path.
   *
   * @param path subsection path from the root
   * @param key leaf key
   * @return {@code true} when {@link #resolve(List, String)} would find a value
   */
  public boolean has(List<String> path, String key) {
    return findValue(path, key).isPresent();
  }

  /**
   * Returns the resolvable leaf keys at a path: local keys in source order (lowest priority first), followed by
   * inherited ancestor keys when cascading. A key from a source that matches names case-insensitively, such as an
   * INI file, is skipped when that source already answers to a listed spelling of it.
   *
   * @param path subsection path from the root
   * @return ordered, de-duplicated key names
   */
  public List<String> keys(List<String> path) {
    Set<String> keys = new LinkedHashSet<>();
    collectKeys(path, keys);
    return List.copyOf(keys);
  }

  /**
   * Returns the union of the sources' subsection names at a path, in source order.
   *
   * @param path subsection path from the root
   * @return ordered, de-duplicated subsection names
   */
  public List<String> subsections(List<String> path) {
    Set<String> names = new LinkedHashSet<>();
    for (ConfigSource source : sources) {
      ConfigSource node = at(source, path);
      if (node != null) {
        names.addAll(node.subsections());
      }
    }
    return List.copyOf(names);
  }

  /**
   * Writes a value for a key that some source already knows, by value or by type declaration.
   *
   * @param path subsection path from the root
   * @param key leaf key
   * @param value new value
   * @throws WriteTargetUnresolvableException if no source knows the key
   */
  public void set(List<String> path, String key, Object value) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(key, "key");
    if (!known(path, key)) {
      throw new WriteTargetUnresolvableException(path, key);
    }
    ConfigSource target = writeTarget(path, key);
    store(target, path, key, value);
  }

  /**
   * Writes a value into the named source, creating the key there if needed.
   *
   * @param path subsection path from the root
   * @param key leaf key
   * @param value new value
   * @param sourceId identifier of the target source; the highest-priority source with that identifier is used
   * @throws IllegalArgumentException if no source has the identifier or it cannot hold the path
   */
  public void set(List<String> path, String key, Object value, String sourceId) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(sourceId, "sourceId");
    for (int i = sources.size() - 1; i >= 0; i--) {
      ConfigSource source = sources.get(i);
      if (sourceId.equals(source.identifier())) {
        store(source, path, key, value);
        return;
      }
    }
    throw new IllegalArgumentException("no configuration source with identifier '" + sourceId + "'");
  }

  /**
   * Persists every dirty source. Each source writes its whole document or nothing.
   *
   * @throws IOException if a source fails to persist
   */
  public void write() throws IOException {
    for (ConfigSource source : sources) {
      if (source.dirty()) {
        log.debug("Persisting configuration source {}", source.identifier());
      }
      source.write();
    }
  }

  private Optional<Hit> findValue(List<String> path, String key) {
    List<String> scope = path;
    while (true) {
      for (int i = sources.size() - 1; i >= 0; i--) {
        ConfigSource node = at(sources.get(i), scope);
        if (node != null && node.has(key)) {
          return Optional.of(new Hit(node, node.get(key)));
        }
      }
      if (!cascade || scope.isEmpty()) {
        return Optional.empty();
      }
      scope = parent(scope);
    }
  }

  private TypedValue typed(List<String> path, String key, Hit hit) {
    Object value = hit.value();
    if (hit.source().typed(key) || (value != null && !(value instanceof String))) {
      return TypedValue.of(value);
    }
    Optional<HintHit> hint = findHint(path, key);
    if (hint.isEmpty()) {
      return TypedValue.of(value);
    }
    ValueKind kind = hint.get().hint().kind();
    if (value == null) {
      return new TypedValue(null, kind);
    }
    String raw = (String) value;
    if (kind == ValueKind.BOOLEAN && hint.get().literal() && !TypeCoercion.isBooleanLiteral(raw)) {
      // a boolean literal default types only boolean-looking text
      return TypedValue.of(raw);
    }
    try {
      return new TypedValue(TypeCoercion.toTyped(raw, kind), kind);
    } catch (ConfigCoercionException ex) {
      throw new ConfigCoercionException(
          "cannot read " + display(path, key) + " as " + kind + ": " + ex.getMessage(), ex);
    }
  }

  private Optional<HintHit> findHint(List<String> path, String key) {
    List<String> scope = path;
    while (true) {
      for (int i = sources.size() - 1; i >= 0; i--) {
        ConfigSource node = at(sources.get(i), scope);
        if (node == null) {
          continue;
        }
        Optional<TypeHint> hint = node.typeHint(key);
        if (hint.isPresent()) {
          return Optional.of(new HintHit(hint.get(), node.has(key)));
        }
      }
      if (!cascade || scope.isEmpty()) {
        return Optional.empty();
      }
      scope = parent(scope);
    }
  }

  private void collectKeys(List<String> path, Set<String> keys) {
    for (ConfigSource source : sources) {
      ConfigSource node = at(source, path);
      if (node == null) {
        continue;
      }
      for (String key : node.keys()) {
        if (!keys.contains(key) && !answersToListedSpelling(node, key, keys)) {
          keys.add(key);
        }
      }
    }
    if (cascade && !path.isEmpty()) {
      collectKeys(parent(path), keys);
    }
  }

  private boolean known(List<String> path, String key) {
    List<String> scope = path;
    while (true) {
      for (ConfigSource source : sources) {
        ConfigSource node = at(source, scope);
        if (node != null && (node.has(key) || node.typed(key))) {
          return true;
        }
      }
      if (!cascade || scope.isEmpty()) {
        return false;
      }
      scope = parent(scope);
    }
  }

  private ConfigSource writeTarget(List<String> path, String key) {
    int knowing = highestKnowing(path, key);
    for (int i = sources.size() - 1; i > knowing; i--) {
      ConfigSource source = sources.get(i);
      if (source.writable() && at(source, path) != null) {
        return source;
      }
    }
    if (knowing < 0) {
      throw new WriteTargetUnresolvableException(path, key);
    }
    return sources.get(knowing);
  }

  private int highestKnowing(List<String> path, String key) {
    int highest = -1;
    List<String> scope = path;
    while (true) {
      for (int i = sources.size() - 1; i > highest; i--) {
        ConfigSource node = at(sources.get(i), scope);
        if (node != null && (node.has(key) || node.typed(key)) && at(sources.get(i), path) != null) {
          highest = i;
          break;
        }
      }
      if (!cascade || scope.isEmpty()) {
        return highest;
      }
      scope = parent(scope);
    }
  }

  private static boolean answersToListedSpelling(ConfigSource node, String key, Set<String> listed) {
    for (String spelling : listed) {
      if (spelling.equalsIgnoreCase(key) && node.has(spelling)) {
        return true;
      }
    }
    return false;
  }

  private void store(ConfigSource source, List<String> path, String key, Object value) {
    ConfigSource node = at(source, path);
    if (node == null) {
      throw new IllegalArgumentException("configuration source '" + source.identifier()
          + "' cannot hold nested subsection " + String.join(".", path));
    }
    node.set(key, value);
    log.debug("Set {} in {} to {}", display(path, key), source.identifier(), Logs.describe(key, value));
  }

  private static ConfigSource at(ConfigSource source, List<String> path) {
    if (!source.supportsNesting() && path.size() > 1) {
      return null;
    }
    ConfigSource node = source;
    for (String name : path) {
      node = node.subsection(name);
    }
    return node;
  }

  private static List<String> parent(List<String> path) {
    return new ArrayList<>(path.subList(0, path.size() - 1));
  }

  private static String display(List<String> path, String key) {
    return path.isEmpty() ? key : String.join(".", path) + "." + key;
  }

  private record Hit(ConfigSource source, Object value) {}

  private record HintHit(TypeHint hint, boolean literal) {}
}
