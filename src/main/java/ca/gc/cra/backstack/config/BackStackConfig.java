package ca.gc.cra.backstack.config;

import ca.gc.cra.backstack.infrastructure.keys.SequentialKeyGenerator;
import ca.gc.cra.backstack.infrastructure.stack.DuplicateKeyPolicy;
import ca.gc.cra.backstack.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings for building back stacks.
 *
 * <p>Recognized keys, all optional:</p>
 * <ul>
 *   <li>{@code keys.strategy}: {@code ulid} (default) or {@code sequential}</li>
 *   <li>{@code keys.prefix}: prefix for sequential keys (default {@code record})</li>
 *   <li>{@code duplicateKeys}: {@code ignore} (default), {@code warn} or {@code fail}</li>
 *   <li>{@code metrics.exporter}: {@code none} (default) or {@code otlp}</li>
 *   <li>{@code initialCapacity}: expected stack depth (default 16)</li>
 *   <li>{@code verbose}: {@code true} raises library logging to DEBUG</li>
 * </ul>
 *
 * @param keyStrategy key minting strategy
 * @param keyPrefix prefix used by {@link KeyStrategy#SEQUENTIAL}
 * @param duplicateKeys push-time key check
 * @param metricsEnabled whether metrics go to OpenTelemetry
 * @param initialCapacity expected stack depth
 * @param verbose whether DEBUG logging is enabled at startup
 * @since 0.1.0
 */
public record BackStackConfig(
    KeyStrategy keyStrategy,
    String keyPrefix,
    DuplicateKeyPolicy duplicateKeys,
    boolean metricsEnabled,
    int initialCapacity,
    boolean verbose) {

  /** YAML section read by {@link #load(Path)}. */
  public static final String SECTION = "backstack";

  private static final int DEFAULT_INITIAL_CAPACITY = 16;

  public BackStackConfig {
    Objects.requireNonNull(keyStrategy, "keyStrategy");
    keyPrefix = Strings.requireNonBlank("keys.prefix", keyPrefix);
    Objects.requireNonNull(duplicateKeys, "duplicateKeys");
    if (initialCapacity < 1) {
      throw new IllegalArgumentException("initialCapacity must be > 0");
    }
  }

  /**
   * Returns the defaults: ULID keys, permissive duplicates, no metrics export, quiet logging.
   *
   * @return default configuration
   */
  public static BackStackConfig defaults() {
    return new BackStackConfig(
        KeyStrategy.ULID,
        SequentialKeyGenerator.DEFAULT_PREFIX,
        DuplicateKeyPolicy.IGNORE,
        false,
        DEFAULT_INITIAL_CAPACITY,
        false);
  }

  /**
   * Builds a configuration from flattened settings; missing keys take defaults.
   *
   * @param values flat settings map; must not be {@code null}
   * @return parsed configuration
   * @throws IllegalArgumentException if a value is invalid
   */
  public static BackStackConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    String prefix = values.get("keys.prefix");
    return new BackStackConfig(
        KeyStrategy.from(values.get("keys.strategy")),
        prefix == null || prefix.isBlank() ? SequentialKeyGenerator.DEFAULT_PREFIX : prefix,
        DuplicateKeyPolicy.from(values.get("duplicateKeys")),
        parseExporter(values.get("metrics.exporter")),
        Strings.parsePositiveInt("initialCapacity", values.get("initialCapacity"), DEFAULT_INITIAL_CAPACITY),
        parseBoolean("verbose", values.get("verbose")));
  }

  /**
   * Loads the {@value #SECTION} section (over {@code common}) from a YAML file.
   *
   * @param path YAML file; a missing file yields {@link #defaults()}
   * @return parsed configuration
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML or a value is invalid
   */
  public static BackStackConfig load(Path path) throws IOException {
    return YamlConfigLoader.load(path, SECTION).map(BackStackConfig::fromMap).orElseGet(BackStackConfig::defaults);
  }

  private static boolean parseExporter(String raw) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "none" -> false;
      case "otlp" -> true;
      default -> throw new IllegalArgumentException("metrics.exporter must be none|otlp, got: " + raw);
    };
  }

  private static boolean parseBoolean(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(name + " must be true|false, got: " + raw);
    };
  }
}
