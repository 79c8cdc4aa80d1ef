package ca.gc.cra.backstack.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadOverlaysSectionOnCommon() throws IOException {
    Path yaml = tempDir.resolve("backstack.yaml");
    Files.writeString(yaml, """
        common:
          verbose: false
          duplicateKeys: warn
        backstack:
          verbose: true
          initialCapacity: 8
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "backstack");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("true", map.get("verbose"));
    assertEquals("warn", map.get("duplicateKeys"));
    assertEquals("8", map.get("initialCapacity"));
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        BackStack:
          keys:
            strategy: sequential
            prefix: screen
          metrics:
            exporter: none
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "backstack").orElseThrow();
    assertEquals("sequential", map.get("keys.strategy"));
    assertEquals("screen", map.get("keys.prefix"));
    assertEquals("none", map.get("metrics.exporter"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertTrue(YamlConfigLoader.load(yaml, "backstack").orElseThrow().isEmpty());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result =
        YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "backstack");

    assertFalse(result.isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - backstack:
            verbose: true
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "backstack"));
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("array.yaml");
    Files.writeString(yaml, """
        backstack:
          keys:
            - ulid
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "backstack"));
  }

  @Test
  void malformedYamlThrows() throws IOException {
    Path yaml = tempDir.resolve("malformed.yaml");
    Files.writeString(yaml, "backstack: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "backstack"));
  }
}
