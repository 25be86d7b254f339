package ca.gc.cra.layeredconfig.infrastructure.source.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.layeredconfig.api.LayeredConfig;
import ca.gc.cra.layeredconfig.application.port.ConfigSource;
import ca.gc.cra.layeredconfig.domain.error.ConfigKeyNotFoundException;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class IniFileSourceTest {
  private static final String SIMPLE = """

      [__root__]
      home = mydata
      processes = 4
      force = True
      extra = foo, bar
      expires = 2014-10-15
      lastrun = 2014-10-15 14:32:07
      """;
  private static final String COMPLEX = """

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

  private Path simpleFile;
  private Path complexFile;

  @BeforeEach
  void writeFixtures() throws IOException {
    simpleFile = tempDir.resolve("simple.ini");
    complexFile = tempDir.resolve("complex.ini");
    Files.writeString(simpleFile, SIMPLE);
    Files.writeString(complexFile, COMPLEX);
  }

  @Test
  void valuesAreUntypedText() {
    IniFileSource simple = new IniFileSource(simpleFile);

    assertEquals(List.of("home", "processes", "force", "extra", "expires", "lastrun"), simple.keys());
    for (String key : simple.keys()) {
      assertTrue(simple.has(key));
      assertFalse(simple.typed(key));
    }
    assertEquals("4", simple.get("processes"));
    assertEquals("True", simple.get("force"));
    assertEquals("foo, bar", simple.get("extra"));
    assertEquals("2014-10-15 14:32:07", simple.get("lastrun"));
    assertEquals(List.of(), simple.subsections());
  }

  @Test
  void sectionsAreOneLevelDeep() {
    IniFileSource complex = new IniFileSource(complexFile);

    assertFalse(complex.supportsNesting());
    assertEquals(Set.of("home", "processes", "force", "extra"), Set.copyOf(complex.keys()));
    assertEquals(List.of("mymodule", "extramodule"), complex.subsections());
    ConfigSource module = complex.subsection("mymodule");
    assertEquals(List.of("force", "extra", "expires"), module.keys());
    assertEquals(List.of(), module.subsections());
    assertEquals(List.of(), module.subsection("arbitrary").keys());
    assertThrows(IllegalArgumentException.class, () -> module.subsection("arbitrary").set("depth", "works"));
  }

  @Test
  void defaultRootSectionCascadesIntoSections() throws IOException {
    Path otherRoot = tempDir.resolve("complex-otherroot.ini");
    Files.writeString(otherRoot, COMPLEX.replace("[__root__]", "[DEFAULT]"));

    LayeredConfig cfg = LayeredConfig.of(new IniFileSource(otherRoot, "DEFAULT"));

    assertEquals("mydata", cfg.get("home"));
    assertEquals("4", cfg.get("processes"));
    assertEquals("False", cfg.section("mymodule").get("force"));
    assertEquals("foo, baz", cfg.section("mymodule").get("extra"));
    assertEquals("2014-10-15", cfg.section("mymodule").get("expires"));
    assertEquals("mydata", cfg.section("mymodule").get("home"));
    assertEquals("4", cfg.section("mymodule").get("processes"));
    assertThrows(ConfigKeyNotFoundException.class, () -> cfg.get("expires"));
    assertEquals(List.of("mymodule", "extramodule"), cfg.subsections());
  }

  @Test
  void missingFileWarnsAndStartsEmpty() {
    Logger logger = (Logger) LoggerFactory.getLogger(IniFileSource.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);

    IniFileSource source;
    try {
      source = new IniFileSource(tempDir.resolve("nonexistent.ini"));
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertEquals(List.of(), source.keys());
    assertTrue(source.writable());
    assertEquals(1, appender.list.size());
    assertEquals(Level.WARN, appender.list.get(0).getLevel());
    assertTrue(appender.list.get(0).getFormattedMessage().contains("nonexistent.ini"));
  }

  @Test
  void writeRewritesWholeFile() throws IOException {
    LayeredConfig cfg = LayeredConfig.of(new IniFileSource(complexFile));

    cfg.section("mymodule").set("expires", LocalDate.of(2014, 10, 24));
    cfg.section("mymodule").write();

    String want = """
        [__root__]
        home = mydata
        processes = 4
        force = True
        extra = foo, bar

        [mymodule]
        force = False
        extra = foo, baz
        expires = 2014-10-24

        [extramodule]
        unique = True

        """;
    assertEquals(want, Files.readString(complexFile).replace("\r\n", "\n"));
  }

  @Test
  void writeWithoutChangesLeavesFileAlone() throws IOException {
    IniFileSource source = new IniFileSource(complexFile);

    source.write();

    assertEquals(COMPLEX, Files.readString(complexFile));
  }

  @Test
  void sourceWithoutFileKeepsWritesInMemory() throws IOException {
    IniFileSource source = new IniFileSource();

    source.set("datadir", "else");
    assertTrue(source.dirty());
    source.write();

    assertFalse(source.dirty());
    assertEquals("else", source.get("datadir"));
    assertTrue(source.file().isEmpty());
  }

  @Test
  void parsesCommentsColonsAndContinuations() throws IOException {
    Path file = tempDir.resolve("syntax.ini");
    Files.writeString(file, """
        # leading comment
        [__root__]
        ; another comment
        Name: value
        motd = first line
          second line
        empty =
        """);

    IniFileSource source = new IniFileSource(file);

    assertEquals(List.of("name", "motd", "empty"), source.keys());
    assertEquals("value", source.get("NAME"));
    assertEquals("first line\nsecond line", source.get("motd"));
    assertEquals("", source.get("empty"));
  }

  @Test
  void malformedFileIsRejected() throws IOException {
    Path noSection = tempDir.resolve("nosection.ini");
    Files.writeString(noSection, "home = mydata\n");
    Path duplicate = tempDir.resolve("duplicate.ini");
    Files.writeString(duplicate, "[a]\nx = 1\n[a]\ny = 2\n");
    Path noSeparator = tempDir.resolve("noseparator.ini");
    Files.writeString(noSeparator, "[a]\njust text\n");

    assertThrows(IllegalArgumentException.class, () -> new IniFileSource(noSection));
    assertThrows(IllegalArgumentException.class, () -> new IniFileSource(duplicate));
    assertThrows(IllegalArgumentException.class, () -> new IniFileSource(noSeparator));
  }
}
