package ca.gc.cra.layeredconfig.infrastructure.source;

import ca.gc.cra.layeredconfig.application.port.ConfigSource;
import ca.gc.cra.layeredconfig.domain.error.ConfigKeyNotFoundException;
import ca.gc.cra.layeredconfig.domain.value.TypeCoercion;
import ca.gc.cra.layeredconfig.domain.value.TypeHint;
import ca.gc.cra.layeredconfig.validation.Strings;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Base for sources whose content is a nested map of arbitrary depth.
 * <p><strong>Why:</strong> Defaults, JSON, YAML, property lists, the environment, and the command line all reduce to
 * an insertion-ordered tree of maps; only typing, value encoding, and persistence differ.</p>
 * <p><strong>Role:</strong> Adapter base implementing {@link ConfigSource}. Subsection views returned by
 * {@link #subsection(String)} share the owning source's tree and dirty flag and create no storage until a write.</p>
 * <p><strong>Tree shape:</strong> nested {@link Section}s are subsections, {@link TypeHint}s are placeholders, anything else
 * (including {@code null}) is a leaf value.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public abstract class TreeConfigSource implements ConfigSource {
  private static final Logger log = LoggerFactory.getLogger(TreeConfigSource.class);

  private final Shared shared;
  private final List<String> path;

  /**
   * Creates a root source with an empty tree.
   *
   * @param identifier backend identifier reported by {@link #identifier()}
   */
  protected TreeConfigSource(String identifier) {
    this.shared = new Shared(Strings.requireNonBlank("identifier", identifier), this);
    this.path = List.of();
  }

  private TreeConfigSource(Shared shared, List<String> path) {
    this.shared = shared;
    this.path = path;
  }

  /**
   * Decides whether a stored native value counts as typed for this backend.
   *
   * @param value non-null leaf value
   * @return {@code true} when the backend natively distinguishes the value's kind
   */
  protected abstract boolean isTypedValue(Object value);

  /**
   * Converts a value passed to {@link #set(String, Object)} into the representation stored in the tree.
   *
   * @param value caller-supplied value, may be {@code null}
   * @return stored value
   */
  protected Object encode(Object value) {
    return TypeCoercion.normalize(value);
  }

  /**
   * Persists the whole tree. Only called on the owning source when dirty.
   *
   * @param tree root map of the source
   * @throws IOException if writing fails
   */
  protected void persist(Map<String, Object> tree) throws IOException {
    // in-memory by default
  }

  /**
   * Replaces the tree contents; used by subclasses while loading.
   *
   * @param tree loaded tree; copied into insertion-ordered maps with leaf values normalized
   */
  protected final void load(Map<?, ?> tree) {
    shared.root = copyTree(tree);
  }

  /** Root map of the owning source; used by subclasses when persisting. */
  protected final Map<String, Object> tree() {
    return shared.root;
  }

  /** Subsection path of this view; empty for the owning source. */
  public final List<String> path() {
    return path;
  }

  @Override
  public String identifier() {
    return shared.identifier;
  }

  @Override
  public boolean supportsNesting() {
    return true;
  }

  @Override
  public List<String> keys() {
    Map<String, Object> node = node();
    if (node == null) {
      return List.of();
    }
    List<String> keys = new ArrayList<>();
    for (Map.Entry<String, Object> entry : node.entrySet()) {
      if (isLeaf(entry.getValue())) {
        keys.add(entry.getKey());
      }
    }
    return keys;
  }

  @Override
  public List<String> subsections() {
    Map<String, Object> node = node();
    if (node == null) {
      return List.of();
    }
    List<String> names = new ArrayList<>();
    for (Map.Entry<String, Object> entry : node.entrySet()) {
      if (entry.getValue() instanceof Section) {
        names.add(entry.getKey());
      }
    }
    return names;
  }

  @Override
  public boolean has(String key) {
    Map<String, Object> node = node();
    return node != null && node.containsKey(key) && isLeaf(node.get(key));
  }

  @Override
  public Optional<TypeHint> typeHint(String key) {
    Map<String, Object> node = node();
    if (node == null) {
      return Optional.empty();
    }
    Object value = node.get(key);
    if (value instanceof TypeHint hint) {
      return Optional.of(hint);
    }
    if (value == null || value instanceof Section || !shared.owner.isTypedValue(value)) {
      return Optional.empty();
    }
    return Optional.of(TypeHint.of(TypeCoercion.kindOf(value)));
  }

  @Override
  public Object get(String key) {
    if (!has(key)) {
      throw new ConfigKeyNotFoundException(path, key);
    }
    return node().get(key);
  }

  @Override
  public ConfigSource subsection(String name) {
    Strings.requireKey("subsection", name);
    List<String> child = new ArrayList<>(path);
    child.add(name);
    return new View(shared, List.copyOf(child));
  }

  @Override
  public void set(String key, Object value) {
    Strings.requireKey("key", key);
    Map<String, Object> node = nodeForWrite();
    Object existing = node.get(key);
    if (existing instanceof Section) {
      throw new IllegalArgumentException("'" + key + "' is a subsection in " + identifier() + ", not a key");
    }
    node.put(key, shared.owner.encode(value));
    if (writable()) {
      shared.dirty = true;
    }
  }

  @Override
  public boolean dirty() {
    return shared.dirty;
  }

  @Override
  public void write() throws IOException {
    if (!shared.dirty) {
      return;
    }
    shared.owner.persist(shared.root);
    shared.dirty = false;
    log.debug("Wrote configuration source {}", identifier());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + identifier() + ", path=" + path + '}';
  }

  private Map<String, Object> node() {
    Map<String, Object> node = shared.root;
    for (String name : path) {
      Object child = node.get(name);
      if (!(child instanceof Section section)) {
        return null;
      }
      node = section;
    }
    return node;
  }

  private Map<String, Object> nodeForWrite() {
    Map<String, Object> node = shared.root;
    for (String name : path) {
      Object child = node.get(name);
      if (child == null && !node.containsKey(name)) {
        child = new Section();
        node.put(name, child);
      }
      if (!(child instanceof Section section)) {
        throw new IllegalArgumentException("'" + name + "' is a key in " + identifier() + ", not a subsection");
      }
      node = section;
    }
    return node;
  }

  private static TreeConfigSource ownerOf(TreeConfigSource source) {
    return source.shared.owner;
  }

  private static boolean isLeaf(Object value) {
    return !(value instanceof Section) && !(value instanceof TypeHint);
  }

  private static Section copyTree(Map<?, ?> input) {
    Objects.requireNonNull(input, "tree");
    Section copy = new Section();
    for (Map.Entry<?, ?> entry : input.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException("configuration keys must be strings (was " + entry.getKey() + ")");
      }
      Object value = entry.getValue();
      copy.put(key, value instanceof Map<?, ?> nested ? copyTree(nested) : TypeCoercion.normalize(value));
    }
    return copy;
  }

  private static final class Shared {
    private final String identifier;
    private final TreeConfigSource owner;
    private Section root = new Section();
    private boolean dirty;

    private Shared(String identifier, TreeConfigSource owner) {
      this.identifier = identifier;
      this.owner = owner;
    }
  }

  /**
   * One level of the tree: leaf values, placeholders, and nested sections by name. Every nested map held by a tree is a
   * section, so navigation never casts.
   */
  protected static final class Section extends LinkedHashMap<String, Object> {
    private static final long serialVersionUID = 1L;

    /** Creates an empty section. */
    public Section() {
      // empty
    }
  }

  private static final class View extends TreeConfigSource {
    private View(Shared shared, List<String> path) {
      super(shared, path);
    }

    @Override
    protected boolean isTypedValue(Object value) {
      throw new IllegalStateException("typing is decided by the owning source");
    }

    @Override
    public boolean carriesTypes() {
      return ownerOf(this).carriesTypes();
    }

    @Override
    public boolean writable() {
      return ownerOf(this).writable();
    }
  }
}
