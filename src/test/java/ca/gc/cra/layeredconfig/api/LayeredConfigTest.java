package ca.gc.cra.layeredconfig.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.layeredconfig.domain.error.ConfigCoercionException;
import ca.gc.cra.layeredconfig.domain.error.ConfigKeyNotFoundException;
import ca.gc.cra.layeredconfig.domain.error.WriteTargetUnresolvableException;
import ca.gc.cra.layeredconfig.domain.value.TypedValue;
import ca.gc.cra.layeredconfig.domain.value.ValueKind;
import ca.gc.cra.layeredconfig.infrastructure.source.CommandLineSource;
import ca.gc.cra.layeredconfig.infrastructure.source.DefaultsSource;
import ca.gc.cra.layeredconfig.infrastructure.source.EnvironmentSource;
import ca.gc.cra.layeredconfig.infrastructure.source.file.IniFileSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LayeredConfigTest {
  private static final String SIMPLE_INI = """

      [__root__]
      home = mydata
      processes = 4
      force = True
      extra = foo, bar
      expires = 2014-10-15
      lastrun = 2014-10-15 14:32:07
      """;
  private static final String COMPLEX_INI = """

      [__root__]
      home = mydata
      processes = 4
      force = True
      extra = foo, bar

      [mymodule]
      force = False
      extra = foo, baz
      expires = 2014-10-15

      [extramodule]
      unique = True
      """;

  @TempDir Path tempDir;

  private Path simpleIni;
  private Path complexIni;

  @BeforeEach
  void writeFixtures() throws IOException {
    simpleIni = tempDir.resolve("simple.ini");
    complexIni = tempDir.resolve("complex.ini");
    Files.writeString(simpleIni, SIMPLE_INI);
    Files.writeString(complexIni, COMPLEX_INI);
  }

  @Test
  void layeredSourcesOverrideInPriorityOrder() {
    Map<String, Object> defaults = Map.of("home", "someplace");
    Map<String, String> env = Map.of("MYAPP_HOME", "yourdata");

    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(defaults));
    assertEquals("someplace", cfg.get("home"));

    cfg = LayeredConfig.of(new DefaultsSource(defaults), new IniFileSource(simpleIni));
    assertEquals("mydata", cfg.get("home"));

    cfg = LayeredConfig.of(new DefaultsSource(defaults), new IniFileSource(simpleIni),
        new EnvironmentSource(env, "MYAPP_"));
    assertEquals("yourdata", cfg.get("home"));

    cfg = LayeredConfig.of(new DefaultsSource(defaults), new IniFileSource(simpleIni),
        new EnvironmentSource(env, "MYAPP_"), new CommandLineSource(List.of("--home=anotherplace")));
    assertEquals("anotherplace", cfg.get("home"));

    List<String> iterated = new ArrayList<>();
    cfg.forEach(iterated::add);
    assertEquals(List.of("home", "processes", "force", "extra", "expires", "lastrun"), iterated);
  }

  @Test
  void defaultsTypeAnIniFile() {
    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(types()), new IniFileSource(complexIni));

    assertEquals("mydata", cfg.get("home"));
    assertEquals(4L, cfg.get("processes"));
    assertEquals(Boolean.TRUE, cfg.get("force"));
    assertEquals(List.of("foo", "bar"), cfg.get("extra"));
    assertEquals(Boolean.FALSE, cfg.section("mymodule").get("force"));
    assertEquals(List.of("foo", "baz"), cfg.section("mymodule").get("extra"));
    assertEquals(LocalDate.of(2014, 10, 15), cfg.section("mymodule").get("expires"));
    assertEquals("True", cfg.section("extramodule").get("unique"));
    assertThrows(ConfigKeyNotFoundException.class, () -> cfg.get("expires"));
    assertThrows(ConfigKeyNotFoundException.class, () -> cfg.section("mymodule").get("home"));
    assertThrows(ConfigKeyNotFoundException.class, () -> cfg.section("mymodule").get("processes"));
  }

  @Test
  void defaultsTypeAnUnconfiguredCommandLine() {
    List<String> args = List.of("--home=mydata", "--processes=4", "--force=True", "--extra=foo", "--extra=bar",
        "--implicitboolean", "--mymodule-force=False", "--mymodule-extra=foo", "--mymodule-extra=baz",
        "--mymodule-expires=2014-10-15", "--mymodule-arbitrary-nesting-depth=works", "--extramodule-unique");
    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(types()), new CommandLineSource(args));

    assertEquals(4L, cfg.get("processes"));
    assertEquals(Boolean.TRUE, cfg.get("force"));
    assertEquals(Boolean.FALSE, cfg.section("mymodule").get("force"));
    assertEquals(List.of("foo", "bar"), cfg.get("extra"));
    assertEquals(LocalDate.of(2014, 10, 15), cfg.section("mymodule").get("expires"));
    assertEquals("works", cfg.lookup("mymodule.arbitrary.nesting.depth"));
    assertEquals(Boolean.TRUE, cfg.get("implicitboolean"));
    assertThrows(ConfigKeyNotFoundException.class, () -> cfg.get("expires"));
  }

  @Test
  void declaredButUnsetKeysAreAbsent() {
    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(types()),
        new CommandLineSource(List.of("--processes=4", "--force=False")));

    assertEquals(4L, cfg.get("processes"));
    assertEquals(4, cfg.getInt("processes"));
    assertThrows(ConfigKeyNotFoundException.class, () -> cfg.get("home"));
    assertThrows(ConfigKeyNotFoundException.class, () -> cfg.get("extra"));
    assertEquals(List.of("processes", "force"), cfg.keys());
  }

  @Test
  void booleanDefaultLeavesOtherTextUntouched() {
    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(Map.of("logfile", true)),
        new CommandLineSource(List.of("--logfile=out.log")));

    assertEquals("out.log", cfg.get("logfile"));
  }

  @Test
  void cascadingSubsectionListsInheritedKeys() {
    Map<String, Object> defaults = new LinkedHashMap<>();
    defaults.put("home", "mydata");
    defaults.put("subsection", Map.of("processes", 4));
    LayeredConfig cfg = LayeredConfig.cascading(new DefaultsSource(defaults));

    assertEquals(List.of("processes", "home"), cfg.section("subsection").keys());
    assertEquals(List.of("subsection"), cfg.subsections());
  }

  @Test
  void resolveReturnsNestedViewForSubsection() {
    LayeredConfig cfg = LayeredConfig.of(new IniFileSource(complexIni));

    TypedValue module = cfg.resolve("mymodule");

    assertEquals(ValueKind.SECTION, module.kind());
    assertEquals(cfg.section("mymodule"), module.value());
    LayeredConfig view = assertInstanceOf(LayeredConfig.class, cfg.get("mymodule"));
    assertEquals(List.of("mymodule"), view.path());
    assertEquals("False", view.get("force"));
  }

  @Test
  void typedAccessorsDispatchOnKind() {
    Map<String, Object> defaults = new LinkedHashMap<>();
    defaults.put("home", "mydata");
    defaults.put("processes", 4);
    defaults.put("force", true);
    defaults.put("extra", List.of("foo", "bar"));
    defaults.put("expires", LocalDate.of(2014, 10, 15));
    defaults.put("lastrun", LocalDateTime.of(2014, 10, 15, 14, 32, 7));
    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(defaults));

    assertEquals("mydata", cfg.getString("home"));
    assertEquals(4L, cfg.getLong("processes"));
    assertTrue(cfg.getBoolean("force"));
    assertEquals(List.of("foo", "bar"), cfg.getList("extra"));
    assertEquals(LocalDate.of(2014, 10, 15), cfg.getDate("expires"));
    assertEquals(LocalDateTime.of(2014, 10, 15, 14, 32, 7), cfg.getDateTime("lastrun"));
    assertEquals("4", cfg.getString("processes"));
    assertThrows(ConfigCoercionException.class, () -> cfg.getLong("home"));
  }

  @Test
  void getWithFallbackReturnsFallbackForUnknownKeys() {
    Map<String, Object> defaults = new LinkedHashMap<>();
    defaults.put("codedefaults", "yes");
    defaults.put("force", false);
    defaults.put("home", "/usr/home");
    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(defaults), new IniFileSource(simpleIni));

    assertEquals("yes", cfg.get("codedefaults", null));
    assertEquals("mydata", cfg.get("home", null));
    assertEquals(Boolean.TRUE, cfg.get("force", null));
    assertNull(cfg.get("nonexistent", null));
    assertEquals("NO!", cfg.get("nonexistent", "NO!"));
    assertTrue(cfg.find("nonexistent").isEmpty());
  }

  @Test
  void modifiedValueIsReadBack() throws IOException {
    Map<String, Object> defaults = new LinkedHashMap<>();
    defaults.put("lastdownload", null);
    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(defaults));
    LocalDateTime now = LocalDateTime.now();

    cfg.set("lastdownload", now);

    assertEquals(now, cfg.get("lastdownload"));
    cfg.write();
  }

  @Test
  void placeholderKeyCanBeSetButUnknownKeyCannot() {
    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(Map.of("placeholder", Integer.class)),
        new CommandLineSource(List.of()));

    cfg.set("placeholder", 42);

    assertEquals(42L, cfg.get("placeholder"));
    assertThrows(WriteTargetUnresolvableException.class, () -> cfg.set("nonexistent", 43));
  }

  @Test
  void explicitTargetWriteStoresCanonicalText() {
    IniFileSource ini = new IniFileSource(simpleIni);
    LayeredConfig cfg = LayeredConfig.of(ini);

    cfg.set("expires", LocalDate.of(2013, 9, 18), IniFileSource.IDENTIFIER);

    assertEquals("2013-09-18", cfg.get("expires"));
    assertTrue(ini.dirty());
  }

  @Test
  void missingIniFileAcceptsWritesAndCreatesFile() throws IOException {
    Path missing = tempDir.resolve("nonexistent.ini");
    DefaultsSource defaults = new DefaultsSource(Map.of("datadir", "something"));
    IniFileSource ini = new IniFileSource(missing);
    LayeredConfig cfg = LayeredConfig.of(defaults, ini);
    assertEquals("something", cfg.get("datadir"));

    cfg.set("datadir", "else");
    cfg.write();

    assertEquals("else", cfg.get("datadir"));
    assertEquals("something", defaults.get("datadir"));
    assertEquals("[__root__]\ndatadir = else\n\n", Files.readString(missing));
    assertEquals(List.of(), LayeredConfig.of(new IniFileSource(tempDir.resolve("other.ini"))).keys());
  }

  @Test
  void writeFromSubsectionPersistsWholeSource() throws IOException {
    LayeredConfig cfg = LayeredConfig.of(new IniFileSource(complexIni));

    cfg.section("mymodule").set("expires", LocalDate.of(2014, 10, 24));
    cfg.section("mymodule").write();

    assertTrue(Files.readString(complexIni).contains("expires = 2014-10-24\n"));
    assertTrue(Files.readString(complexIni).startsWith("[__root__]\nhome = mydata\n"));
  }

  @Test
  void asMapSnapshotsResolvedTree() {
    Map<String, Object> module = new LinkedHashMap<>();
    module.put("force", false);
    module.put("arbitrary", Map.of("nesting", Map.of("depth", "works")));
    Map<String, Object> defaults = new LinkedHashMap<>();
    defaults.put("home", "mydata");
    defaults.put("mymodule", module);
    LayeredConfig cfg = LayeredConfig.of(new DefaultsSource(defaults));

    Map<String, Object> snapshot = cfg.asMap();

    assertEquals(Map.of("home", "mydata",
        "mymodule", Map.of("force", false, "arbitrary", Map.of("nesting", Map.of("depth", "works")))), snapshot);
    assertEquals(List.of("home", "mymodule"), List.copyOf(snapshot.keySet()));
  }

  private static Map<String, Object> types() {
    Map<String, Object> module = new LinkedHashMap<>();
    module.put("force", Boolean.class);
    module.put("extra", List.class);
    module.put("expires", LocalDate.class);
    module.put("lastrun", LocalDateTime.class);
    Map<String, Object> types = new LinkedHashMap<>();
    types.put("home", String.class);
    types.put("processes", Integer.class);
    types.put("force", Boolean.class);
    types.put("extra", List.class);
    types.put("mymodule", module);
    return types;
  }
}
