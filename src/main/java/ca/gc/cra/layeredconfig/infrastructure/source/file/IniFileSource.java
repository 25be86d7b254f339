package ca.gc.cra.layeredconfig.infrastructure.source.file;

import ca.gc.cra.layeredconfig.application.port.ConfigSource;
import ca.gc.cra.layeredconfig.domain.error.ConfigKeyNotFoundException;
import ca.gc.cra.layeredconfig.domain.value.TypeCoercion;
import ca.gc.cra.layeredconfig.domain.value.TypeHint;
import ca.gc.cra.layeredconfig.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Untyped source backed by an INI file with one level of sections.
 * <p><strong>Why:</strong> INI is the most common hand-edited configuration format; it carries text only, so typing
 * comes from hints declared by other sources.</p>
 * <p><strong>Layout:</strong> keys outside any subsection live in the root section ({@code __root__} unless configured
 * otherwise); every other section is a first-level subsection. Option names are lower-cased. {@code key = value} and
 * {@code key: value} are accepted, lines starting with {@code #} or {@code ;} are comments, and indented lines continue
 * the previous value.</p>
 * <p><strong>DEFAULT section:</strong> a section named {@code DEFAULT} supplies its keys to every other section. Using
 * {@code DEFAULT} as the root section therefore makes root keys visible in all subsections.</p>
 * <p><strong>Persistence:</strong> a missing file yields an empty source that creates the file on {@link #write()};
 * a source built without a path accepts writes but never persists them. Writes rewrite the whole file: root section
 * first, then the other sections in order, each followed by a blank line.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class IniFileSource implements ConfigSource {
  /** Identifier used for explicit-target writes. */
  public static final String IDENTIFIER = "inifile";
  /** Root section used when none is configured. */
  public static final String DEFAULT_ROOT_SECTION = "__root__";
  /** Section whose keys every other section inherits. */
  public static final String DEFAULT_SECTION = "DEFAULT";

  private static final Logger log = LoggerFactory.getLogger(IniFileSource.class);

  private final Document document;
  private final List<String> path;

  /** Creates an in-memory source with no backing file. */
  public IniFileSource() {
    this(null, DEFAULT_ROOT_SECTION);
  }

  /**
   * Loads the INI file, or starts empty when it does not exist.
   *
   * @param file backing file
   * @throws IllegalArgumentException when the file is malformed
   */
  public IniFileSource(Path file) {
    this(file, DEFAULT_ROOT_SECTION);
  }

  /**
   * Loads the INI file with a custom root section name.
   *
   * @param file backing file, or {@code null} for an in-memory source
   * @param rootSection section holding keys that belong to no subsection
   * @throws IllegalArgumentException when the file is malformed or the section name is blank
   */
  public IniFileSource(Path file, String rootSection) {
    this.document = new Document(file, Strings.requireNonBlank("rootSection", rootSection));
    this.path = List.of();
    if (file != null) {
      document.load();
    }
  }

  private IniFileSource(Document document, List<String> path) {
    this.document = document;
    this.path = path;
  }

  /** Backing file, if any. */
  public Optional<Path> file() {
    return Optional.ofNullable(document.file);
  }

  /** Name of the section holding root keys. */
  public String rootSection() {
    return document.rootSection;
  }

  @Override
  public String identifier() {
    return IDENTIFIER;
  }

  @Override
  public boolean supportsNesting() {
    return false;
  }

  @Override
  public boolean carriesTypes() {
    return false;
  }

  @Override
  public boolean writable() {
    return true;
  }

  @Override
  public List<String> keys() {
    Set<String> keys = new LinkedHashSet<>();
    Map<String, String> own = section();
    if (own != null) {
      keys.addAll(own.keySet());
    }
    Map<String, String> inherited = inherited();
    if (inherited != null) {
      keys.addAll(inherited.keySet());
    }
    return List.copyOf(keys);
  }

  @Override
  public List<String> subsections() {
    if (!path.isEmpty()) {
      return List.of();
    }
    List<String> names = new ArrayList<>();
    for (String name : document.sections.keySet()) {
      if (!name.equals(document.rootSection) && !name.equals(DEFAULT_SECTION)) {
        names.add(name);
      }
    }
    return names;
  }

  @Override
  public boolean has(String key) {
    String option = optionName(key);
    Map<String, String> own = section();
    if (own != null && own.containsKey(option)) {
      return true;
    }
    Map<String, String> inherited = inherited();
    return inherited != null && inherited.containsKey(option);
  }

  @Override
  public Optional<TypeHint> typeHint(String key) {
    return Optional.empty();
  }

  @Override
  public Object get(String key) {
    String option = optionName(key);
    Map<String, String> own = section();
    if (own != null && own.containsKey(option)) {
      return own.get(option);
    }
    Map<String, String> inherited = inherited();
    if (inherited != null && inherited.containsKey(option)) {
      return inherited.get(option);
    }
    throw new ConfigKeyNotFoundException(path, key);
  }

  @Override
  public ConfigSource subsection(String name) {
    Strings.requireKey("subsection", name);
    List<String> child = new ArrayList<>(path);
    child.add(name);
    return new IniFileSource(document, List.copyOf(child));
  }

  @Override
  public void set(String key, Object value) {
    Strings.requireKey("key", key);
    if (path.size() > 1) {
      throw new IllegalArgumentException("INI files hold one level of subsections; cannot set "
          + String.join(".", path) + "." + key);
    }
    String raw = value == null ? "" : TypeCoercion.toRaw(TypeCoercion.normalize(value));
    document.sections.computeIfAbsent(sectionName(), ignored -> new LinkedHashMap<>()).put(optionName(key), raw);
    document.dirty = true;
  }

  @Override
  public boolean dirty() {
    return document.dirty;
  }

  @Override
  public void write() throws IOException {
    if (!document.dirty) {
      return;
    }
    if (document.file == null) {
      log.debug("INI source has no backing file; keeping changes in memory");
    } else {
      Path parent = document.file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(document.file, document.render(), StandardCharsets.UTF_8);
      log.debug("Wrote INI file {}", document.file);
    }
    document.dirty = false;
  }

  @Override
  public String toString() {
    return "IniFileSource{file=" + document.file + ", section=" + (path.size() > 1 ? "<none>" : sectionName()) + '}';
  }

  private String sectionName() {
    return path.isEmpty() ? document.rootSection : path.get(0);
  }

  private Map<String, String> section() {
    return path.size() > 1 ? null : document.sections.get(sectionName());
  }

  private Map<String, String> inherited() {
    if (path.size() > 1 || DEFAULT_SECTION.equals(sectionName())) {
      return null;
    }
    return document.sections.get(DEFAULT_SECTION);
  }

  private static String optionName(String key) {
    return key.toLowerCase(Locale.ROOT);
  }

  /** Sections of one file, shared by the root source and its section views. */
  private static final class Document {
    private final Path file;
    private final String rootSection;
    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    private boolean dirty;

    private Document(Path file, String rootSection) {
      this.file = file;
      this.rootSection = rootSection;
    }

    private void load() {
      List<String> lines;
      try {
        lines = Files.readAllLines(file, StandardCharsets.UTF_8);
      } catch (NoSuchFileException ex) {
        log.warn("Configuration file {} does not exist; {} starts empty", file, IDENTIFIER);
        return;
      } catch (IOException ex) {
        log.warn("Configuration file {} could not be read; {} starts empty", file, IDENTIFIER, ex);
        return;
      }
      parse(lines);
      log.debug("Loaded {} sections from {}", sections.size(), file);
    }

    private void parse(List<String> lines) {
      Map<String, String> current = null;
      String lastOption = null;
      for (int i = 0; i < lines.size(); i++) {
        String line = lines.get(i);
        if (i == 0 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
          line = line.substring(1);
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
          lastOption = null;
          continue;
        }
        if (trimmed.startsWith("#") || trimmed.startsWith(";")) {
          continue;
        }
        if (Character.isWhitespace(line.charAt(0)) && current != null && lastOption != null) {
          String previous = current.get(lastOption);
          current.put(lastOption, previous.isEmpty() ? trimmed : previous + "\n" + trimmed);
          continue;
        }
        if (trimmed.startsWith("[")) {
          if (!trimmed.endsWith("]") || trimmed.length() < 3) {
            throw malformed(i, "invalid section header " + trimmed);
          }
          String name = trimmed.substring(1, trimmed.length() - 1).strip();
          if (sections.containsKey(name)) {
            throw malformed(i, "duplicate section [" + name + "]");
          }
          current = new LinkedHashMap<>();
          sections.put(name, current);
          lastOption = null;
          continue;
        }
        if (current == null) {
          throw malformed(i, "option outside of any section");
        }
        int separator = separatorIndex(trimmed);
        if (separator <= 0) {
          throw malformed(i, "expected 'key = value' but found " + trimmed);
        }
        String option = trimmed.substring(0, separator).strip().toLowerCase(Locale.ROOT);
        if (current.containsKey(option)) {
          throw malformed(i, "duplicate option " + option);
        }
        current.put(option, trimmed.substring(separator + 1).strip());
        lastOption = option;
      }
    }

    private String render() {
      StringBuilder out = new StringBuilder();
      Map<String, String> root = sections.get(rootSection);
      if (root != null) {
        renderSection(out, rootSection, root);
      }
      for (Map.Entry<String, Map<String, String>> entry : sections.entrySet()) {
        if (!entry.getKey().equals(rootSection)) {
          renderSection(out, entry.getKey(), entry.getValue());
        }
      }
      return out.toString();
    }

    private static void renderSection(StringBuilder out, String name, Map<String, String> options) {
      out.append('[').append(name).append("]\n");
      for (Map.Entry<String, String> option : options.entrySet()) {
        out.append(option.getKey()).append(" = ").append(option.getValue().replace("\n", "\n\t")).append('\n');
      }
      out.append('\n');
    }

    private static int separatorIndex(String line) {
      int equals = line.indexOf('=');
      int colon = line.indexOf(':');
      if (equals < 0) {
        return colon;
      }
      return colon < 0 ? equals : Math.min(equals, colon);
    }

    private IllegalArgumentException malformed(int index, String message) {
      return new IllegalArgumentException("Failed to parse INI config at " + file + " line " + (index + 1)
          + ": " + message);
    }
  }
}
