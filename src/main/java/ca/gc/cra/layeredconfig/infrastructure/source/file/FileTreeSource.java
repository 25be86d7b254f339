package ca.gc.cra.layeredconfig.infrastructure.source.file;

import ca.gc.cra.layeredconfig.domain.value.TypeCoercion;
import ca.gc.cra.layeredconfig.infrastructure.source.TreeConfigSource;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Base for structured-markup file sources (JSON, YAML, property lists).
 * <p><strong>Loading:</strong> a missing or unreadable file is logged at WARN and yields an empty source that still
 * accepts writes; malformed content raises {@link IllegalArgumentException} naming the file.</p>
 * <p><strong>Writing:</strong> the whole document is rendered from the tree and replaces the file.</p>
 *
 * @since 0.1.0
 */
public abstract class FileTreeSource extends TreeConfigSource {
  private static final Logger log = LoggerFactory.getLogger(FileTreeSource.class);

  private final Path file;

  /**
   * Creates the source; subclasses call {@link #loadFile(DocumentReader)} once their own state is ready.
   *
   * @param identifier backend identifier
   * @param file backing file; need not exist yet
   */
  protected FileTreeSource(String identifier, Path file) {
    super(identifier);
    this.file = Objects.requireNonNull(file, "file");
  }

  /** Parses document text into its root mapping. */
  @FunctionalInterface
  protected interface DocumentReader {
    /**
     * Parses a document.
     *
     * @param text file contents
     * @return root value of the document, {@code null} when empty
     * @throws IllegalArgumentException when the content is malformed
     */
    Object read(String text);
  }

  /**
   * Renders the whole tree as document text.
   *
   * @param tree root map
   * @return document text written verbatim
   * @throws IOException if rendering fails
   */
  protected abstract String render(Map<String, Object> tree) throws IOException;

  /** Backing file. */
  public final Path file() {
    return file;
  }

  @Override
  public boolean carriesTypes() {
    return true;
  }

  @Override
  public boolean writable() {
    return true;
  }

  /**
   * Reads and loads the backing file.
   *
   * @param reader format parser
   */
  protected final void loadFile(DocumentReader reader) {
    String text;
    try {
      text = Files.readString(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException ex) {
      log.warn("Configuration file {} does not exist; {} starts empty", file, identifier());
      return;
    } catch (IOException ex) {
      log.warn("Configuration file {} could not be read; {} starts empty", file, identifier(), ex);
      return;
    }
    if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
      text = text.substring(1);
    }
    Object document;
    try {
      document = reader.read(text);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Failed to parse " + identifier() + " config at " + file, ex);
    }
    load(asTree(document, file.toString()));
    log.debug("Loaded {} from {}", identifier(), file);
  }

  @Override
  protected final void persist(Map<String, Object> tree) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(file, render(tree), StandardCharsets.UTF_8);
  }

  /**
   * Converts dates to their canonical text; used by formats that have no date type.
   *
   * @param value caller-supplied value
   * @return text for dates, the normalized value otherwise
   */
  protected static Object datesAsText(Object value) {
    if (value instanceof LocalDate || value instanceof LocalDateTime) {
      return TypeCoercion.toRaw(value);
    }
    return TypeCoercion.normalize(value);
  }

  /**
   * Copies a map with its keys sorted alphabetically at every level.
   *
   * @param tree map to copy
   * @return sorted copy
   */
  protected static Section sorted(Map<String, Object> tree) {
    Section sorted = new Section();
    for (Map.Entry<String, Object> entry : new TreeMap<>(tree).entrySet()) {
      Object value = entry.getValue();
      sorted.put(entry.getKey(), value instanceof Section nested ? sorted(nested) : value);
    }
    return sorted;
  }

  private static Map<String, Object> asTree(Object document, String context) {
    if (document == null) {
      return new LinkedHashMap<>();
    }
    if (!(document instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException("root of " + context + " must be a mapping");
    }
    return mapping(map, context);
  }

  private static Map<String, Object> mapping(Map<?, ?> raw, String context) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(context + " contains a blank or non-string key");
      }
      Object value = entry.getValue();
      map.put(key, value instanceof Map<?, ?> nested ? mapping(nested, context + "." + key) : leaf(value, key));
    }
    return map;
  }

  private static Object leaf(Object value, String key) {
    if (value instanceof Collection<?> items) {
      List<Object> list = new ArrayList<>(items.size());
      for (Object item : items) {
        if (item instanceof Map<?, ?> || item instanceof Collection<?>) {
          throw new IllegalArgumentException("list " + key + " may only hold scalar values");
        }
        list.add(scalar(item));
      }
      return list;
    }
    return scalar(value);
  }

  private static Object scalar(Object value) {
    if (value instanceof BigInteger big && big.bitLength() > Long.SIZE - 1) {
      // beyond the integer kind, kept as text like decimals
      return big.toString();
    }
    if (value == null || value instanceof String || value instanceof Boolean || value instanceof LocalDate
        || value instanceof LocalDateTime || value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
      return value;
    }
    // decimals and other scalars have no kind of their own
    return value.toString();
  }
}
