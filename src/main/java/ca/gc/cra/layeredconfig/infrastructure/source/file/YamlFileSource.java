package ca.gc.cra.layeredconfig.infrastructure.source.file;

import ca.gc.cra.layeredconfig.domain.value.TypeCoercion;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Map;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

/**
 * <strong>What:</strong> Source backed by a YAML document of arbitrary nesting.
 * <p><strong>Typing:</strong> every value is typed. YAML timestamps load as {@link LocalDate} when they carry no time
 * and as UTC {@link LocalDateTime} otherwise.</p>
 * <p><strong>Output:</strong> block style, keys sorted at every level, two-space indentation, plain dates.</p>
 *
 * @since 0.1.0
 */
public final class YamlFileSource extends FileTreeSource {
  /** Identifier used for explicit-target writes. */
  public static final String IDENTIFIER = "yamlfile";

  private static final Pattern DATE_ONLY = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

  private final Yaml yaml;

  /**
   * Loads the YAML file, or starts empty when it does not exist.
   *
   * @param file backing file
   * @throws IllegalArgumentException when the document is malformed or not a mapping
   */
  public YamlFileSource(Path file) {
    super(IDENTIFIER, file);
    LoaderOptions loaderOptions = new LoaderOptions();
    DumperOptions dumperOptions = new DumperOptions();
    dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    dumperOptions.setIndent(2);
    this.yaml = new Yaml(new TimestampConstructor(loaderOptions), new TimestampRepresenter(dumperOptions),
        dumperOptions, loaderOptions);
    loadFile(this::parse);
  }

  @Override
  protected boolean isTypedValue(Object value) {
    return true;
  }

  @Override
  protected String render(Map<String, Object> tree) {
    return yaml.dump(sorted(tree));
  }

  private Object parse(String text) {
    try {
      return yaml.load(text);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML document", ex);
    }
  }

  private static final class TimestampConstructor extends SafeConstructor {
    private TimestampConstructor(LoaderOptions options) {
      super(options);
      this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructLocalTimestamp());
    }

    private static final class ConstructLocalTimestamp extends AbstractConstruct {
      private final ConstructYamlTimestamp timestamps = new ConstructYamlTimestamp();

      @Override
      public Object construct(Node node) {
        String text = ((ScalarNode) node).getValue().trim();
        Date date = (Date) timestamps.construct(node);
        LocalDateTime utc = LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
        return DATE_ONLY.matcher(text).matches() ? utc.toLocalDate() : utc;
      }
    }
  }

  private static final class TimestampRepresenter extends Representer {
    private TimestampRepresenter(DumperOptions options) {
      super(options);
      this.representers.put(LocalDate.class, data -> representScalar(Tag.TIMESTAMP, data.toString()));
      this.representers.put(LocalDateTime.class,
          data -> representScalar(Tag.TIMESTAMP, TypeCoercion.toRaw(data)));
    }
  }
}
