package ca.gc.cra.backstack.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.backstack.infrastructure.stack.DuplicateKeyPolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BackStackConfigTest {

  @TempDir Path tempDir;

  @Test
  void emptyMapYieldsDefaults() {
    assertEquals(BackStackConfig.defaults(), BackStackConfig.fromMap(Map.of()));
  }

  @Test
  void defaultsArePermissiveAndQuiet() {
    BackStackConfig config = BackStackConfig.defaults();

    assertEquals(KeyStrategy.ULID, config.keyStrategy());
    assertEquals("record", config.keyPrefix());
    assertEquals(DuplicateKeyPolicy.IGNORE, config.duplicateKeys());
    assertFalse(config.metricsEnabled());
    assertEquals(16, config.initialCapacity());
    assertFalse(config.verbose());
  }

  @Test
  void fromMapParsesEverySetting() {
    BackStackConfig config = BackStackConfig.fromMap(Map.of(
        "keys.strategy", "Sequential",
        "keys.prefix", "screen",
        "duplicateKeys", "FAIL",
        "metrics.exporter", "otlp",
        "initialCapacity", "4",
        "verbose", "true"));

    assertEquals(KeyStrategy.SEQUENTIAL, config.keyStrategy());
    assertEquals("screen", config.keyPrefix());
    assertEquals(DuplicateKeyPolicy.FAIL, config.duplicateKeys());
    assertTrue(config.metricsEnabled());
    assertEquals(4, config.initialCapacity());
    assertTrue(config.verbose());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> BackStackConfig.fromMap(Map.of("keys.strategy", "uuid")));
    assertThrows(IllegalArgumentException.class,
        () -> BackStackConfig.fromMap(Map.of("duplicateKeys", "explode")));
    assertThrows(IllegalArgumentException.class,
        () -> BackStackConfig.fromMap(Map.of("metrics.exporter", "prometheus")));
    assertThrows(IllegalArgumentException.class,
        () -> BackStackConfig.fromMap(Map.of("initialCapacity", "-2")));
    assertThrows(IllegalArgumentException.class,
        () -> BackStackConfig.fromMap(Map.of("verbose", "yes please")));
  }

  @Test
  void loadReadsBackStackSection() throws IOException {
    Path yaml = tempDir.resolve("backstack.yaml");
    Files.writeString(yaml, """
        common:
          duplicateKeys: warn
        backstack:
          keys:
            strategy: sequential
            prefix: nav
          initialCapacity: 32
        """);

    BackStackConfig config = BackStackConfig.load(yaml);

    assertEquals(KeyStrategy.SEQUENTIAL, config.keyStrategy());
    assertEquals("nav", config.keyPrefix());
    assertEquals(DuplicateKeyPolicy.WARN, config.duplicateKeys());
    assertEquals(32, config.initialCapacity());
  }

  @Test
  void loadMissingFileYieldsDefaults() throws IOException {
    assertEquals(BackStackConfig.defaults(), BackStackConfig.load(tempDir.resolve("absent.yaml")));
  }
}
