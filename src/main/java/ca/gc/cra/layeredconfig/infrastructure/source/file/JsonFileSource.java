package ca.gc.cra.layeredconfig.infrastructure.source.file;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Source backed by a JSON document of arbitrary nesting.
 * <p><strong>Typing:</strong> booleans, integers and arrays are typed; strings are not, so dates stay text and are
 * written back as {@code YYYY-MM-DD} strings. Decimal numbers are kept as their text.</p>
 * <p><strong>Output:</strong> keys sorted at every level, four-space indentation, {@code ": "} between name and value,
 * {@code []}/{@code {}} for empty containers, and no trailing newline.</p>
 *
 * @since 0.1.0
 */
public final class JsonFileSource extends FileTreeSource {
  /** Identifier used for explicit-target writes. */
  public static final String IDENTIFIER = "jsonfile";

  private final JsonFactory factory = new JsonFactory();

  /**
   * Loads the JSON file, or starts empty when it does not exist.
   *
   * @param file backing file
   * @throws IllegalArgumentException when the file is not a JSON object
   */
  public JsonFileSource(Path file) {
    super(IDENTIFIER, file);
    loadFile(this::parse);
  }

  @Override
  protected boolean isTypedValue(Object value) {
    return !(value instanceof String);
  }

  @Override
  protected Object encode(Object value) {
    return datesAsText(value);
  }

  @Override
  protected String render(Map<String, Object> tree) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.setPrettyPrinter(new IndentPrinter());
      writeObject(gen, sorted(tree));
    }
    return out.toString();
  }

  private Object parse(String json) {
    try (JsonParser parser = factory.createParser(json)) {
      if (parser.nextToken() == null) {
        return null;
      }
      if (!parser.isExpectedStartObjectToken()) {
        throw new IllegalArgumentException("JSON config must be an object but starts with " + parser.currentToken());
      }
      Map<String, Object> root = readSection(parser);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("JSON config has content after its root object");
      }
      return root;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON document: " + ex.getMessage(), ex);
    }
  }

  /** Reads the members of an object whose start token is current; nested objects become subsections. */
  private static Map<String, Object> readSection(JsonParser parser) throws IOException {
    Map<String, Object> section = new LinkedHashMap<>();
    for (String name = parser.nextFieldName(); name != null; name = parser.nextFieldName()) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.START_OBJECT) {
        section.put(name, readSection(parser));
      } else if (token == JsonToken.START_ARRAY) {
        section.put(name, readList(parser, name));
      } else {
        section.put(name, readSetting(parser, name));
      }
    }
    return section;
  }

  private static List<Object> readList(JsonParser parser, String name) throws IOException {
    List<Object> items = new ArrayList<>();
    while (parser.nextToken() != JsonToken.END_ARRAY) {
      if (parser.currentToken().isStructStart()) {
        throw new IllegalArgumentException("list " + name + " may only hold scalar values");
      }
      items.add(readSetting(parser, name));
    }
    return items;
  }

  private static Object readSetting(JsonParser parser, String name) throws IOException {
    JsonToken token = parser.currentToken();
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (token.isBoolean()) {
      return parser.getBooleanValue();
    }
    if (token == JsonToken.VALUE_NUMBER_INT && parser.getNumberType() != JsonParser.NumberType.BIG_INTEGER) {
      return parser.getLongValue();
    }
    if (token.isScalarValue()) {
      // strings, decimals, and integers beyond the long range stay text
      return parser.getText();
    }
    throw new IllegalArgumentException("unexpected " + token + " for " + name);
  }

  private static void writeObject(JsonGenerator gen, Map<String, Object> map) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      gen.writeFieldName(entry.getKey());
      Object value = entry.getValue();
      if (value instanceof Section nested) {
        writeObject(gen, nested);
      } else {
        writeValue(gen, value);
      }
    }
    gen.writeEndObject();
  }

  private static void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Long number) {
      gen.writeNumber(number.longValue());
    } else if (value instanceof List<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(String.valueOf(datesAsText(value)));
    }
  }

  /** Python-style pretty printing: no padding before {@code :} and nothing between empty brackets. */
  private static final class IndentPrinter extends DefaultPrettyPrinter {
    private static final long serialVersionUID = 1L;

    private IndentPrinter() {
      super(Separators.createDefaultInstance().withObjectFieldValueSpacing(Separators.Spacing.AFTER));
      DefaultIndenter indenter = new DefaultIndenter("    ", "\n");
      indentObjectsWith(indenter);
      indentArraysWith(indenter);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
      return new IndentPrinter();
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
      if (!_objectIndenter.isInline()) {
        --_nesting;
      }
      if (nrOfEntries > 0) {
        _objectIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
      if (!_arrayIndenter.isInline()) {
        --_nesting;
      }
      if (nrOfValues > 0) {
        _arrayIndenter.writeIndentation(g, _nesting);
      }
      g.writeRaw(']');
    }
  }
}
