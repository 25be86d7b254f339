package ca.gc.cra.layeredconfig.infrastructure.source.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.layeredconfig.api.LayeredConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlFileSourceTest {
  private static final String SIMPLE = """
      home: mydata
      processes: 4
      force: true
      extra:
      - foo
      - bar
      expires: 2014-10-15
      lastrun: 2014-10-15 14:32:07
      """;
  private static final String COMPLEX = """
      home: mydata
      processes: 4
      force: true
      extra:
      - foo
      - bar
      mymodule:
          force: false
          extra:
          - foo
          - baz
          expires: 2014-10-15
          arbitrary:
              nesting:
                  depth: works
      extramodule:
          unique: true
      """;

  @TempDir Path tempDir;

  private Path simpleFile;
  private Path complexFile;

  @BeforeEach
  void writeFixtures() throws IOException {
    simpleFile = tempDir.resolve("simple.yaml");
    complexFile = tempDir.resolve("complex.yaml");
    Files.writeString(simpleFile, SIMPLE);
    Files.writeString(complexFile, COMPLEX);
  }

  @Test
  void everyValueIsTyped() {
    YamlFileSource simple = new YamlFileSource(simpleFile);

    for (String key : simple.keys()) {
      assertTrue(simple.typed(key), key);
    }
    assertEquals("mydata", simple.get("home"));
    assertEquals(4L, simple.get("processes"));
    assertEquals(Boolean.TRUE, simple.get("force"));
    assertEquals(List.of("foo", "bar"), simple.get("extra"));
    assertEquals(LocalDate.of(2014, 10, 15), simple.get("expires"));
    assertEquals(LocalDateTime.of(2014, 10, 15, 14, 32, 7), simple.get("lastrun"));
  }

  @Test
  void nestedMappingsAreSubsections() {
    LayeredConfig cfg = LayeredConfig.of(new YamlFileSource(complexFile));

    assertEquals(List.of("home", "processes", "force", "extra"), cfg.keys());
    assertEquals(List.of("mymodule", "extramodule"), cfg.subsections());
    assertEquals(LocalDate.of(2014, 10, 15), cfg.section("mymodule").getDate("expires"));
    assertEquals("works", cfg.lookup("mymodule.arbitrary.nesting.depth"));
  }

  @Test
  void writeRendersSortedBlockDocument() throws IOException {
    LayeredConfig cfg = LayeredConfig.of(new YamlFileSource(complexFile));

    cfg.section("mymodule").set("expires", LocalDate.of(2014, 10, 24));
    cfg.write();

    String want = """
        extra:
        - foo
        - bar
        extramodule:
          unique: true
        force: true
        home: mydata
        mymodule:
          arbitrary:
            nesting:
              depth: works
          expires: 2014-10-24
          extra:
          - foo
          - baz
          force: false
        processes: 4
        """;
    assertEquals(want, Files.readString(complexFile));
  }

  @Test
  void nonAsciiTextRoundTrips() throws IOException {
    Path file = tempDir.resolve("i18n.yaml");
    Files.writeString(file, "shrimpsandwich: Räksmörgås\n");

    YamlFileSource source = new YamlFileSource(file);
    assertEquals("Räksmörgås", source.get("shrimpsandwich"));

    source.set("shrimpsandwich", "Räksmörgås!");
    source.write();

    assertEquals("shrimpsandwich: Räksmörgås!\n", Files.readString(file));
  }

  @Test
  void dateTimesAreWrittenAsTimestamps() throws IOException {
    Path file = tempDir.resolve("fresh.yaml");
    YamlFileSource source = new YamlFileSource(file);

    source.set("lastrun", LocalDateTime.of(2014, 10, 30, 21, 30, 0));
    source.write();

    YamlFileSource reloaded = new YamlFileSource(file);
    assertEquals(LocalDateTime.of(2014, 10, 30, 21, 30, 0), reloaded.get("lastrun"));
  }

  @Test
  void integersBeyondLongAreKeptAsText() throws IOException {
    Path file = tempDir.resolve("big.yaml");
    Files.writeString(file, "n: 18446744073709551617\nprocesses: 4\n");

    YamlFileSource source = new YamlFileSource(file);

    assertEquals("18446744073709551617", source.get("n"));
    assertEquals(4L, source.get("processes"));
  }

  @Test
  void nonMappingDocumentIsRejected() throws IOException {
    Path list = tempDir.resolve("list.yaml");
    Files.writeString(list, "- foo\n- bar\n");
    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "home: [mydata\n");

    assertThrows(IllegalArgumentException.class, () -> new YamlFileSource(list));
    assertThrows(IllegalArgumentException.class, () -> new YamlFileSource(broken));
  }
}
