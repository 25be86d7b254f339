package ca.gc.cra.layeredconfig.infrastructure.source.file;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * <strong>What:</strong> Source backed by an XML property list of arbitrary nesting.
 * <p><strong>Typing:</strong> {@code integer}, {@code true}/{@code false}, {@code array} and {@code date} values are
 * typed; {@code string} values are not. Property lists have no plain date type, so a {@link LocalDate} is stored as a
 * string; {@code date} elements load as UTC {@link LocalDateTime}s.</p>
 * <p><strong>Output:</strong> the Apple plist 1.0 document with tab indentation and keys sorted at every level.</p>
 *
 * @since 0.1.0
 */
public final class PlistFileSource extends FileTreeSource {
  /** Identifier used for explicit-target writes. */
  public static final String IDENTIFIER = "plistfile";

  private static final Logger log = LoggerFactory.getLogger(PlistFileSource.class);

  private static final String HEADER = """
      <?xml version="1.0" encoding="UTF-8"?>
      <!DOCTYPE plist PUBLIC "-//Apple//DTD PLIST 1.0//EN" "http://www.apple.com/DTDs/PropertyList-1.0.dtd">
      <plist version="1.0">
      """;
  private static final DateTimeFormatter DATE_OUT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

  /**
   * Loads the property list, or starts empty when it does not exist.
   *
   * @param file backing file
   * @throws IllegalArgumentException when the document is malformed or its root is not a {@code dict}
   */
  public PlistFileSource(Path file) {
    super(IDENTIFIER, file);
    loadFile(PlistFileSource::parse);
  }

  @Override
  protected boolean isTypedValue(Object value) {
    return !(value instanceof String);
  }

  @Override
  protected Object encode(Object value) {
    if (value instanceof LocalDate date) {
      return date.toString();
    }
    return super.encode(value);
  }

  @Override
  protected String render(Map<String, Object> tree) {
    StringBuilder out = new StringBuilder(HEADER);
    writeDict(out, sorted(tree), 0);
    out.append("</plist>\n");
    return out.toString();
  }

  private static Object parse(String xml) {
    SAXParserFactory factory = SAXParserFactory.newInstance();
    factory.setNamespaceAware(false);
    factory.setValidating(false);
    PlistHandler handler = new PlistHandler();
    try {
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      SAXParser parser = factory.newSAXParser();
      parser.parse(new InputSource(new StringReader(xml)), handler);
    } catch (ParserConfigurationException | SAXException | IOException ex) {
      throw new IllegalArgumentException("Invalid property list: " + ex.getMessage(), ex);
    }
    return handler.root;
  }

  private static void writeDict(StringBuilder out, Map<String, Object> dict, int depth) {
    if (dict.isEmpty()) {
      indent(out, depth).append("<dict/>\n");
      return;
    }
    indent(out, depth).append("<dict>\n");
    for (Map.Entry<String, Object> entry : dict.entrySet()) {
      indent(out, depth + 1).append("<key>").append(escape(entry.getKey())).append("</key>\n");
      Object value = entry.getValue();
      if (value instanceof Section nested) {
        writeDict(out, nested, depth + 1);
      } else {
        writeValue(out, entry.getKey(), value, depth + 1);
      }
    }
    indent(out, depth).append("</dict>\n");
  }

  private static void writeValue(StringBuilder out, String key, Object value, int depth) {
    if (value == null) {
      // no null element exists; the key survives as an empty string
      log.debug("Writing empty value of {} as an empty string", key);
      indent(out, depth).append("<string></string>\n");
    } else if (value instanceof Boolean flag) {
      indent(out, depth).append(flag ? "<true/>" : "<false/>").append('\n');
    } else if (value instanceof Long number) {
      indent(out, depth).append("<integer>").append(number).append("</integer>\n");
    } else if (value instanceof LocalDateTime dateTime) {
      indent(out, depth).append("<date>").append(DATE_OUT.format(dateTime)).append("</date>\n");
    } else if (value instanceof List<?> items) {
      if (items.isEmpty()) {
        indent(out, depth).append("<array/>\n");
        return;
      }
      indent(out, depth).append("<array>\n");
      for (Object item : items) {
        writeValue(out, key, item, depth + 1);
      }
      indent(out, depth).append("</array>\n");
    } else {
      indent(out, depth).append("<string>").append(escape(value.toString())).append("</string>\n");
    }
  }

  private static StringBuilder indent(StringBuilder out, int depth) {
    for (int i = 0; i < depth; i++) {
      out.append('\t');
    }
    return out;
  }

  private static String escape(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }

  /** Builds the document tree from SAX events with a stack of open containers. */
  private static final class PlistHandler extends DefaultHandler {
    private final Deque<Object> containers = new ArrayDeque<>();
    private final Deque<String> pendingKeys = new ArrayDeque<>();
    private final StringBuilder text = new StringBuilder();
    private Object root;

    @Override
    public void startElement(String uri, String localName, String qName, Attributes attributes) {
      text.setLength(0);
      switch (qName) {
        case "dict" -> containers.push(new Section());
        case "array" -> containers.push(new OpenArray());
        default -> {
          // scalar content is collected by characters()
        }
      }
    }

    @Override
    public void characters(char[] ch, int start, int length) {
      text.append(ch, start, length);
    }

    @Override
    public void endElement(String uri, String localName, String qName) throws SAXException {
      switch (qName) {
        case "plist" -> {
          // document wrapper
        }
        case "dict", "array" -> add(close(containers.pop()));
        case "key" -> pendingKeys.push(text.toString());
        case "string", "data" -> add(text.toString());
        case "real" -> add(text.toString().trim());
        case "integer" -> add(integer(text.toString().trim()));
        case "true" -> add(Boolean.TRUE);
        case "false" -> add(Boolean.FALSE);
        case "date" -> add(date(text.toString().trim()));
        default -> throw new SAXException("unsupported property list element <" + qName + ">");
      }
      text.setLength(0);
    }

    private void add(Object value) throws SAXException {
      Object top = containers.peek();
      if (top == null) {
        root = value;
      } else if (top instanceof Section dict) {
        if (pendingKeys.isEmpty()) {
          throw new SAXException("dict value without a preceding <key>");
        }
        dict.put(pendingKeys.pop(), value);
      } else if (top instanceof OpenArray array) {
        array.items.add(value);
      }
    }

    private static Object close(Object container) {
      return container instanceof OpenArray array ? array.items : container;
    }

    private static Long integer(String raw) throws SAXException {
      try {
        return Long.parseLong(raw);
      } catch (NumberFormatException ex) {
        throw new SAXException("invalid <integer> value '" + raw + "'", ex);
      }
    }

    private static LocalDateTime date(String raw) throws SAXException {
      try {
        return LocalDateTime.ofInstant(Instant.parse(raw), ZoneOffset.UTC);
      } catch (DateTimeParseException ex) {
        throw new SAXException("invalid <date> value '" + raw + "'", ex);
      }
    }
  }

  /** Items of an {@code <array>} still being read. */
  private static final class OpenArray {
    private final List<Object> items = new ArrayList<>();
  }
}
