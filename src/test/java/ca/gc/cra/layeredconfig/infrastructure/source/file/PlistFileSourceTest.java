package ca.gc.cra.layeredconfig.infrastructure.source.file;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
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

class PlistFileSourceTest {
  private static final String HEADER = """
      <?xml version="1.0" encoding="UTF-8"?>
      <!DOCTYPE plist PUBLIC "-//Apple//DTD PLIST 1.0//EN" "http://www.apple.com/DTDs/PropertyList-1.0.dtd">
      <plist version="1.0">
      """;
  private static final String SIMPLE = HEADER + """
      <dict>
              <key>home</key>
              <string>mydata</string>
              <key>processes</key>
              <integer>4</integer>
              <key>force</key>
              <true/>
              <key>extra</key>
              <array>
                      <string>foo</string>
                      <string>bar</string>
              </array>
              <key>expires</key>
              <string>2014-10-15</string>
              <key>lastrun</key>
              <date>2014-10-15T14:32:07Z</date>
      </dict>
      </plist>
      """;
  private static final String COMPLEX = HEADER + """
      <dict>
              <key>home</key>
              <string>mydata</string>
              <key>processes</key>
              <integer>4</integer>
              <key>force</key>
              <true/>
              <key>extra</key>
              <array>
                      <string>foo</string>
                      <string>bar</string>
              </array>
              <key>mymodule</key>
              <dict>
                      <key>force</key>
                      <false/>
                      <key>extra</key>
                      <array>
                              <string>foo</string>
                              <string>baz</string>
                      </array>
                      <key>expires</key>
                      <string>2014-10-15</string>
                      <key>arbitrary</key>
                      <dict>
                              <key>nesting</key>
                              <dict>
                                      <key>depth</key>
                                      <string>works</string>
                              </dict>
                      </dict>
              </dict>
              <key>extramodule</key>
              <dict>
                      <key>unique</key>
                      <true/>
              </dict>
      </dict>
      </plist>
      """;

  @TempDir Path tempDir;

  private Path simpleFile;
  private Path complexFile;

  @BeforeEach
  void writeFixtures() throws IOException {
    simpleFile = tempDir.resolve("simple.plist");
    complexFile = tempDir.resolve("complex.plist");
    Files.writeString(simpleFile, SIMPLE);
    Files.writeString(complexFile, COMPLEX);
  }

  @Test
  void elementsMapToKinds() {
    PlistFileSource simple = new PlistFileSource(simpleFile);

    assertEquals(List.of("home", "processes", "force", "extra", "expires", "lastrun"), simple.keys());
    assertEquals(4L, simple.get("processes"));
    assertEquals(Boolean.TRUE, simple.get("force"));
    assertEquals(List.of("foo", "bar"), simple.get("extra"));
    assertEquals(LocalDateTime.of(2014, 10, 15, 14, 32, 7), simple.get("lastrun"));
    assertTrue(simple.typed("lastrun"));
    assertFalse(simple.typed("expires"));
    assertFalse(simple.typed("home"));
  }

  @Test
  void dictsAreSubsections() {
    LayeredConfig cfg = LayeredConfig.of(new PlistFileSource(complexFile));

    assertEquals(List.of("mymodule", "extramodule"), cfg.subsections());
    assertEquals(Boolean.FALSE, cfg.section("mymodule").get("force"));
    assertEquals("works", cfg.lookup("mymodule.arbitrary.nesting.depth"));
    assertEquals(Boolean.TRUE, cfg.section("extramodule").get("unique"));
  }

  @Test
  void writeRendersSortedPropertyList() throws IOException {
    LayeredConfig cfg = LayeredConfig.of(new PlistFileSource(complexFile));

    cfg.section("mymodule").set("expires", LocalDate.of(2014, 10, 24));
    cfg.write();

    String want = HEADER + """
        <dict>
        \t<key>extra</key>
        \t<array>
        \t\t<string>foo</string>
        \t\t<string>bar</string>
        \t</array>
        \t<key>extramodule</key>
        \t<dict>
        \t\t<key>unique</key>
        \t\t<true/>
        \t</dict>
        \t<key>force</key>
        \t<true/>
        \t<key>home</key>
        \t<string>mydata</string>
        \t<key>mymodule</key>
        \t<dict>
        \t\t<key>arbitrary</key>
        \t\t<dict>
        \t\t\t<key>nesting</key>
        \t\t\t<dict>
        \t\t\t\t<key>depth</key>
        \t\t\t\t<string>works</string>
        \t\t\t</dict>
        \t\t</dict>
        \t\t<key>expires</key>
        \t\t<string>2014-10-24</string>
        \t\t<key>extra</key>
        \t\t<array>
        \t\t\t<string>foo</string>
        \t\t\t<string>baz</string>
        \t\t</array>
        \t\t<key>force</key>
        \t\t<false/>
        \t</dict>
        \t<key>processes</key>
        \t<integer>4</integer>
        </dict>
        </plist>
        """;
    assertEquals(want, Files.readString(complexFile));
  }

  @Test
  void dateTimesAndMarkupSurviveWrite() throws IOException {
    Path file = tempDir.resolve("fresh.plist");
    PlistFileSource source = new PlistFileSource(file);

    source.set("lastrun", LocalDateTime.of(2014, 10, 30, 21, 30, 0));
    source.set("motto", "fish & <chips>");
    source.write();

    PlistFileSource reloaded = new PlistFileSource(file);
    assertEquals(LocalDateTime.of(2014, 10, 30, 21, 30, 0), reloaded.get("lastrun"));
    assertEquals("fish & <chips>", reloaded.get("motto"));
    assertTrue(Files.readString(file).contains("<date>2014-10-30T21:30:00Z</date>"));
  }

  @Test
  void unsupportedElementsAreRejected() throws IOException {
    Path file = tempDir.resolve("broken.plist");
    Files.writeString(file, HEADER + "<dict>\n<key>x</key>\n<blob>1</blob>\n</dict>\n</plist>\n");
    Path notDict = tempDir.resolve("array.plist");
    Files.writeString(notDict, HEADER + "<array>\n<string>x</string>\n</array>\n</plist>\n");

    assertThrows(IllegalArgumentException.class, () -> new PlistFileSource(file));
    assertThrows(IllegalArgumentException.class, () -> new PlistFileSource(notDict));
  }
}
