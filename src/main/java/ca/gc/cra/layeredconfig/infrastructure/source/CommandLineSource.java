package ca.gc.cra.layeredconfig.infrastructure.source;

import ca.gc.cra.layeredconfig.domain.value.TypeCoercion;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;

/**
 * <strong>What:</strong> Source built from command-line arguments.
 * <p><strong>Unconfigured:</strong> every {@code --key=value} is a string, a bare {@code --key} is {@code true}, and a
 * repeated option accumulates into a list. Dashes split subsections, so {@code --mymodule-force} addresses key
 * {@code force} in subsection {@code mymodule}. Arguments that do not start with {@code --} are ignored.</p>
 * <p><strong>Configured:</strong> a picocli {@link CommandSpec} parses the arguments and each matched option
 * contributes its converted value, which gives the same typing as {@link DefaultsSource}. Declared options that do
 * not appear in the arguments are absent. {@link CommandLineConverters} adapts the canonical text encodings for
 * option declarations.</p>
 * <p><strong>Typing:</strong> a value is typed unless it is a plain string.</p>
 *
 * @since 0.1.0
 */
public final class CommandLineSource extends TreeConfigSource {
  /** Identifier used for explicit-target writes. */
  public static final String IDENTIFIER = "commandline";

  private static final Logger log = LoggerFactory.getLogger(CommandLineSource.class);

  /**
   * Parses arguments without a declared option model.
   *
   * @param args raw arguments
   */
  public CommandLineSource(List<String> args) {
    super(IDENTIFIER);
    Objects.requireNonNull(args, "args");
    load(parseUnconfigured(args));
  }

  /**
   * Parses arguments with a declared option model.
   *
   * @param args raw arguments
   * @param spec picocli command specification declaring the accepted options
   * @throws IllegalArgumentException if picocli rejects the arguments
   */
  public CommandLineSource(List<String> args, CommandSpec spec) {
    super(IDENTIFIER);
    Objects.requireNonNull(args, "args");
    Objects.requireNonNull(spec, "spec");
    load(parseConfigured(args, spec));
  }

  /**
   * Parses arguments against a picocli-annotated command object.
   *
   * @param args raw arguments
   * @param command object whose fields carry {@code @Option} annotations
   * @return configured source
   * @throws IllegalArgumentException if picocli rejects the arguments
   */
  public static CommandLineSource forCommand(List<String> args, Object command) {
    return new CommandLineSource(args, CommandSpec.forAnnotatedObject(Objects.requireNonNull(command, "command")));
  }

  @Override
  public boolean carriesTypes() {
    return true;
  }

  @Override
  public boolean writable() {
    return false;
  }

  @Override
  protected boolean isTypedValue(Object value) {
    return !(value instanceof String);
  }

  private static Map<String, Object> parseUnconfigured(List<String> args) {
    Section root = new Section();
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        log.debug("Ignoring non-option argument {}", arg);
        continue;
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      String name = eq < 0 ? body : body.substring(0, eq);
      Object value = eq < 0 ? Boolean.TRUE : body.substring(eq + 1);
      List<String> segments = segments(name);
      if (segments.isEmpty()) {
        log.debug("Ignoring malformed option {}", arg);
        continue;
      }
      if (!place(root, segments, value, true)) {
        log.debug("Ignoring option {}; it clashes with another option's subsection", arg);
      }
    }
    return freezeLists(root);
  }

  private static Map<String, Object> parseConfigured(List<String> args, CommandSpec spec) {
    ParseResult result;
    try {
      result = new CommandLine(spec).parseArgs(args.toArray(new String[0]));
    } catch (ParameterException ex) {
      throw new IllegalArgumentException("Invalid command line: " + ex.getMessage(), ex);
    }
    Section root = new Section();
    Set<OptionSpec> matched = new LinkedHashSet<>(result.matchedOptions());
    for (OptionSpec option : matched) {
      List<String> segments = segments(option.longestName());
      if (segments.isEmpty()) {
        continue;
      }
      if (!place(root, segments, TypeCoercion.normalize(option.getValue()), false)) {
        log.debug("Ignoring option {}; it clashes with another option's subsection", option.longestName());
      }
    }
    return root;
  }

  private static List<String> segments(String name) {
    String stripped = name;
    while (stripped.startsWith("-")) {
      stripped = stripped.substring(1);
    }
    if (stripped.isEmpty()) {
      return List.of();
    }
    List<String> segments = List.of(stripped.split("-", -1));
    return segments.contains("") ? List.of() : segments;
  }

  private static boolean place(Map<String, Object> root, List<String> segments, Object value, boolean accumulate) {
    Map<String, Object> node = root;
    for (String segment : segments.subList(0, segments.size() - 1)) {
      if (!(node.computeIfAbsent(segment, ignored -> new Section()) instanceof Section section)) {
        return false;
      }
      node = section;
    }
    String key = segments.get(segments.size() - 1);
    Object existing = node.get(key);
    if (existing instanceof Section) {
      return false;
    }
    if (accumulate && node.containsKey(key)) {
      List<Object> values = existing instanceof Accumulated acc ? acc.values : new ArrayList<>(List.of(existing));
      values.add(value);
      node.put(key, new Accumulated(values));
    } else {
      node.put(key, value);
    }
    return true;
  }

  private static Map<String, Object> freezeLists(Map<String, Object> node) {
    for (Map.Entry<String, Object> entry : node.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Accumulated acc) {
        List<String> items = new ArrayList<>(acc.values.size());
        for (Object item : acc.values) {
          items.add(String.valueOf(item));
        }
        entry.setValue(List.copyOf(items));
      } else if (value instanceof Section nested) {
        freezeLists(nested);
      }
    }
    return node;
  }

  private static final class Accumulated {
    private final List<Object> values;

    private Accumulated(List<Object> values) {
      this.values = values;
    }
  }
}
