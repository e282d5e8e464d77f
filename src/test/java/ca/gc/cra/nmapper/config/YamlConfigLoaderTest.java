package ca.gc.cra.nmapper.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void commandSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("nmapper.yaml");
    Files.writeString(yaml, """
        common:
          storage:
            type: memory
          notify:
            sink: none
        monitor:
          monitor:
            range: 192.168.1.0/24
            interval: 10m
          notify:
            sink: log
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "MONITOR").orElseThrow();

    assertEquals("memory", map.get("storage.type"));
    assertEquals("192.168.1.0/24", map.get("monitor.range"));
    assertEquals("10m", map.get("monitor.interval"));
    assertEquals("log", map.get("notify.sink"));
  }

  @Test
  void otherCommandSectionsAreIgnored() throws IOException {
    Path yaml = tempDir.resolve("nmapper.yaml");
    Files.writeString(yaml, """
        scan:
          profile: quick
        diff:
          format: json
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "diff").orElseThrow();

    assertEquals(Map.of("format", "json"), map);
  }

  @Test
  void scannerCommandMayBeAList() throws IOException {
    Path yaml = tempDir.resolve("nmapper.yaml");
    Files.writeString(yaml, """
        common:
          scanner:
            command: [nmap-json, --profile, "{profile}", "{target}"]
          storage:
            password:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "scan").orElseThrow();

    assertEquals("nmap-json --profile {profile} {target}", map.get("scanner.command"));
    assertEquals("", map.get("storage.password"));
  }

  @Test
  void missingFileIsEmpty() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "scan").isPresent());
  }

  @Test
  void emptyDocumentHasNoKeys() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertTrue(YamlConfigLoader.load(yaml, "scan").orElseThrow().isEmpty());
  }

  @Test
  void rejectsMalformedStructures() throws IOException {
    Path scalarRoot = tempDir.resolve("scalar.yaml");
    Files.writeString(scalarRoot, "just text\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalarRoot, "scan"));

    Path nestedList = tempDir.resolve("nested-list.yaml");
    Files.writeString(nestedList, """
        scan:
          scanner:
            command:
              - [a, b]
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(nestedList, "scan"));

    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "common: [unclosed\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken, "scan"));
  }
}
