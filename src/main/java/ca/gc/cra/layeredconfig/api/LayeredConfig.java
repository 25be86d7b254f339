package ca.gc.cra.layeredconfig.api;

import ca.gc.cra.layeredconfig.application.port.ConfigSource;
import ca.gc.cra.layeredconfig.application.resolve.Resolver;
import ca.gc.cra.layeredconfig.domain.error.ConfigCoercionException;
import ca.gc.cra.layeredconfig.domain.error.ConfigKeyNotFoundException;
import ca.gc.cra.layeredconfig.domain.error.WriteTargetUnresolvableException;
import ca.gc.cra.layeredconfig.domain.value.TypedValue;
import ca.gc.cra.layeredconfig.domain.value.ValueKind;
import ca.gc.cra.layeredconfig.validation.Strings;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Key-addressable view over one node of a layered configuration tree.
 * <p><strong>Why:</strong> Callers read a single, typed configuration regardless of whether a setting came from code
 * defaults, a file, the environment, or the command line.</p>
 * <p><strong>Role:</strong> Public entry point. The root instance owns the {@link Resolver}; every subsection view
 * obtained through {@link #section(String)} shares it and only adds a path.</p>
 * <p><strong>Usage:</strong></p>
 * <pre>{@code
 * LayeredConfig cfg = LayeredConfig.of(
 *     new DefaultsSource(Map.of("home", "someplace", "processes", Integer.class)),
 *     new IniFileSource(Path.of("myapp.ini")),
 *     new EnvironmentSource("MYAPP_"),
 *     new CommandLineSource(args));
 * String home = cfg.getString("home");
 * long processes = cfg.getLong("processes");
 * cfg.section("mymodule").set("force", true);
 * cfg.write();
 * }</pre>
 * <p><strong>Protocol:</strong> reading an undefined key raises {@link ConfigKeyNotFoundException}; reading a defined one
 * returns its typed value, or a nested view when the name is a subsection; writing an unknown key raises
 * {@link WriteTargetUnresolvableException}; iteration yields leaf key names only.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; changes through any view are visible to all views of the same
 * tree.</p>
 *
 * @since 0.1.0
 */
public final class LayeredConfig implements Iterable<String> {
  private final Resolver resolver;
  private final List<String> path;

  /**
   * Creates a non-cascading configuration.
   *
   * @param sources sources ordered from lowest to highest priority
   */
  public LayeredConfig(ConfigSource... sources) {
    this(Arrays.asList(sources), false);
  }

  /**
   * Creates a configuration.
   *
   * @param sources sources ordered from lowest to highest priority
   * @param cascade whether subsections inherit unset keys from their ancestors
   */
  public LayeredConfig(List<? extends ConfigSource> sources, boolean cascade) {
    this(new Resolver(sources, cascade), List.of());
  }

  private LayeredConfig(Resolver resolver, List<String> path) {
    this.resolver = resolver;
    this.path = List.copyOf(path);
  }

  /**
   * Creates a non-cascading configuration.
   *
   * @param sources sources ordered from lowest to highest priority
   * @return root view
   */
  public static LayeredConfig of(ConfigSource... sources) {
    return new LayeredConfig(Arrays.asList(sources), false);
  }

  /**
   * Creates a configuration whose subsections inherit unset keys from their ancestors.
   *
   * @param sources sources ordered from lowest to highest priority
   * @return root view
   */
  public static LayeredConfig cascading(ConfigSource... sources) {
    return new LayeredConfig(Arrays.asList(sources), true);
  }

  /** Subsection path of this view; empty for the root. */
  public List<String> path() {
    return path;
  }

  /** Sources shared by every view of this tree, lowest priority first. */
  public List<ConfigSource> sources() {
    return resolver.sources();
  }

  /** Whether subsections inherit unset keys from their ancestors. */
  public boolean cascade() {
    return resolver.cascade();
  }

  /**
   * Resolves a name at this node: a leaf key yields its typed value, a subsection yields a
   * {@link ValueKind#SECTION} value wrapping the nested view.
   *
   * @param key leaf key or subsection name
   * @return typed value
   * @throws ConfigKeyNotFoundException if the name is neither a resolvable key nor a known subsection
   * @throws ConfigCoercionException if the value's text is malformed for its hinted kind
   */
  public TypedValue resolve(String key) {
    return find(key).orElseThrow(() -> new ConfigKeyNotFoundException(path, key));
  }

  /**
   * Optional form of {@link #resolve(String)}.
   *
   * @param key leaf key or subsection name
   * @return typed value, or empty when the name is unknown
   */
  public Optional<TypedValue> find(String key) {
    Strings.requireKey("key", key);
    Optional<TypedValue> leaf = resolver.find(path, key);
    if (leaf.isPresent()) {
      return leaf;
    }
    if (resolver.subsections(path).contains(key)) {
      return Optional.of(new TypedValue(section(key), ValueKind.SECTION));
    }
    return Optional.empty();
  }

  /**
   * Returns the value of a key, or the nested view of a subsection.
   *
   * @param key leaf key or subsection name
   * @return resolved value; {@code null} only for a present-but-empty setting
   * @throws ConfigKeyNotFoundException if the name is unknown
   */
  public Object get(String key) {
    return resolve(key).value();
  }

  /**
   * Explicit-default read for optional settings.
   *
   * @param key leaf key or subsection name
   * @param fallback value returned when the name is unknown
   * @return resolved value, or {@code fallback}
   */
  public Object get(String key, Object fallback) {
    Optional<TypedValue> found = find(key);
    return found.isPresent() ? found.get().value() : fallback;
  }

  /**
   * Resolves a dotted path such as {@code mymodule.arbitrary.depth} relative to this node.
   *
   * @param dottedPath subsection names followed by the leaf key, separated by dots
   * @return resolved value
   * @throws ConfigKeyNotFoundException if the final name is unknown in its subsection
   */
  public Object lookup(String dottedPath) {
    Strings.requireNonBlank("path", dottedPath);
    String[] parts = dottedPath.split("\\.");
    LayeredConfig node = this;
    for (int i = 0; i < parts.length - 1; i++) {
      node = node.section(parts[i]);
    }
    return node.get(parts[parts.length - 1]);
  }

  /** Returns the text form of a leaf value. */
  public String getString(String key) {
    return leaf(key).asString();
  }

  /** Returns an integer value; requires {@link ValueKind#INTEGER}. */
  public long getLong(String key) {
    return leaf(key).asLong();
  }

  /**
   * Returns an integer value narrowed to {@code int}.
   *
   * @param key leaf key
   * @return value
   * @throws ConfigCoercionException if the value is not an integer or overflows {@code int}
   */
  public int getInt(String key) {
    long value = getLong(key);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new ConfigCoercionException("value of " + key + " does not fit in an int: " + value);
    }
    return (int) value;
  }

  /** Returns a boolean value; requires {@link ValueKind#BOOLEAN}. */
  public boolean getBoolean(String key) {
    return leaf(key).asBoolean();
  }

  /** Returns a list value; requires {@link ValueKind#LIST}. */
  public List<String> getList(String key) {
    return leaf(key).asList();
  }

  /** Returns a date value; requires {@link ValueKind#DATE}. */
  public LocalDate getDate(String key) {
    return leaf(key).asDate();
  }

  /** Returns a date-time value; requires {@link ValueKind#DATETIME}. */
  public LocalDateTime getDateTime(String key) {
    return leaf(key).asDateTime();
  }

  /**
   * Navigates to a subsection. Always succeeds; keys are looked up lazily when read.
   *
   * @param name subsection name
   * @return view over the subsection, sharing this tree's sources
   */
  public LayeredConfig section(String name) {
    Strings.requireKey("section", name);
    List<String> child = new ArrayList<>(path);
    child.add(name);
    return new LayeredConfig(resolver, child);
  }

  /**
   * Returns whether a leaf key resolves to a value at this node.
   *
   * @param key leaf key
   * @return {@code true} when the key is readable
   */
  public boolean has(String key) {
    return resolver.has(path, Strings.requireKey("key", key));
  }

  /** Resolvable leaf keys at this node, lowest-priority source first, then inherited keys when cascading. */
  public List<String> keys() {
    return resolver.keys(path);
  }

  /** Subsection names at this node, in source order. */
  public List<String> subsections() {
    return resolver.subsections(path);
  }

  @Override
  public Iterator<String> iterator() {
    return keys().iterator();
  }

  /**
   * Writes a key that some source already defines, by value or by type placeholder.
   *
   * @param key leaf key
   * @param value new value
   * @throws WriteTargetUnresolvableException if no source defines the key
   */
  public void set(String key, Object value) {
    resolver.set(path, Strings.requireKey("key", key), value);
  }

  /**
   * Writes a key into the named source, creating it there if needed.
   *
   * @param key leaf key
   * @param value new value
   * @param sourceId identifier of the target source, for example {@code inifile}
   * @throws IllegalArgumentException if no source has the identifier
   */
  public void set(String key, Object value, String sourceId) {
    resolver.set(path, Strings.requireKey("key", key), value, sourceId);
  }

  /**
   * Persists every dirty source of the whole tree, whichever view this is called on.
   *
   * @throws IOException if a source cannot be written
   */
  public void write() throws IOException {
    resolver.write();
  }

  /**
   * Snapshots the resolved tree below this node: leaf keys map to typed values, subsections to nested maps.
   *
   * @return insertion-ordered snapshot
   */
  public Map<String, Object> asMap() {
    Map<String, Object> snapshot = new LinkedHashMap<>();
    for (String key : keys()) {
      snapshot.put(key, resolver.resolve(path, key).value());
    }
    for (String name : subsections()) {
      if (!snapshot.containsKey(name)) {
        snapshot.put(name, section(name).asMap());
      }
    }
    return snapshot;
  }

  @Override
  public String toString() {
    return "LayeredConfig{path=" + (path.isEmpty() ? "<root>" : String.join(".", path))
        + ", keys=" + keys() + ", subsections=" + subsections() + '}';
  }

  private TypedValue leaf(String key) {
    Strings.requireKey("key", key);
    return resolver.resolve(path, key);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LayeredConfig that)) {
      return false;
    }
    return resolver == that.resolver && path.equals(that.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(resolver), path);
  }
}
