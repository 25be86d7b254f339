package ca.gc.cra.layeredconfig.infrastructure.source;

import ca.gc.cra.layeredconfig.domain.value.TypeCoercion;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Untyped source reading environment variables that share a prefix.
 * <p><strong>Mapping:</strong> the prefix is matched case-insensitively and stripped, the remainder is lower-cased, and
 * each {@code _} starts a subsection, so {@code MYAPP_MYMODULE_FORCE} becomes key {@code force} in subsection
 * {@code mymodule}.</p>
 * <p><strong>Writes:</strong> {@link #set(String, Object)} only changes the in-memory view; the process environment is
 * never modified.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentSource extends TreeConfigSource {
  /** Identifier used for explicit-target writes. */
  public static final String IDENTIFIER = "environment";

  private static final Logger log = LoggerFactory.getLogger(EnvironmentSource.class);

  private final String prefix;

  /**
   * Reads the process environment.
   *
   * @param prefix variable-name prefix such as {@code MYAPP_}; empty selects every variable
   */
  public EnvironmentSource(String prefix) {
    this(new TreeMap<>(System.getenv()), prefix);
  }

  /**
   * Reads the supplied variables, in the map's iteration order.
   *
   * @param environment variable names mapped to values
   * @param prefix variable-name prefix such as {@code MYAPP_}; empty selects every variable
   */
  public EnvironmentSource(Map<String, String> environment, String prefix) {
    super(IDENTIFIER);
    Objects.requireNonNull(environment, "environment");
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    load(parse(environment, prefix));
  }

  /** Variable-name prefix selecting this source's variables. */
  public String prefix() {
    return prefix;
  }

  @Override
  public boolean carriesTypes() {
    return false;
  }

  @Override
  public boolean writable() {
    return false;
  }

  @Override
  protected boolean isTypedValue(Object value) {
    return false;
  }

  @Override
  protected Object encode(Object value) {
    return value == null ? null : TypeCoercion.toRaw(TypeCoercion.normalize(value));
  }

  private static Map<String, Object> parse(Map<String, String> environment, String prefix) {
    String wanted = prefix.toLowerCase(Locale.ROOT);
    Section root = new Section();
    for (Map.Entry<String, String> entry : environment.entrySet()) {
      String name = entry.getKey();
      if (name == null || entry.getValue() == null) {
        continue;
      }
      String lowered = name.toLowerCase(Locale.ROOT);
      if (!lowered.startsWith(wanted) || lowered.length() == wanted.length()) {
        continue;
      }
      List<String> segments = List.of(lowered.substring(wanted.length()).split("_", -1));
      if (segments.contains("")) {
        log.debug("Ignoring environment variable {} with an empty name segment", name);
        continue;
      }
      if (!place(root, segments, entry.getValue())) {
        log.debug("Ignoring environment variable {}; it clashes with another variable's subsection", name);
      }
    }
    return root;
  }

  private static boolean place(Map<String, Object> root, List<String> segments, String value) {
    Map<String, Object> node = root;
    for (String segment : segments.subList(0, segments.size() - 1)) {
      if (!(node.computeIfAbsent(segment, ignored -> new Section()) instanceof Section section)) {
        return false;
      }
      node = section;
    }
    String key = segments.get(segments.size() - 1);
    if (node.get(key) instanceof Section) {
      return false;
    }
    node.put(key, value);
    return true;
  }
}
