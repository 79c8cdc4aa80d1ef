package ca.gc.cra.backstack.config;

import ca.gc.cra.backstack.application.nav.BackStackNavigator;
import ca.gc.cra.backstack.application.port.KeyGenerator;
import ca.gc.cra.backstack.application.port.MetricsPort;
import ca.gc.cra.backstack.domain.nav.BackStack;
import ca.gc.cra.backstack.domain.nav.Destination;
import ca.gc.cra.backstack.domain.nav.StackRecord;
import ca.gc.cra.backstack.infrastructure.keys.SequentialKeyGenerator;
import ca.gc.cra.backstack.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.backstack.infrastructure.stack.ObservableBackStack;
import ca.gc.cra.backstack.logging.LoggingConfigurator;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that turns a {@link BackStackConfig} into wired stacks and navigators.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter ({@link OpenTelemetryMetricsAdapter} or {@link MetricsPort#NO_OP}).</li>
 *   <li>Select the key generator for records minted from bare destinations.</li>
 *   <li>Apply the verbose logging switch once at construction.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods create new instances.
 * Sequential keys come from one generator shared by every stack this factory creates, so keys never repeat
 * across those stacks.</p>
 *
 * @since 0.1.0
 */
public final class BackStackFactory {
  private static final Logger log = LoggerFactory.getLogger(BackStackFactory.class);

  private final BackStackConfig config;
  private final MetricsPort metrics;
  private final KeyGenerator keys;

  /**
   * Creates a factory, building the metrics adapter the configuration asks for.
   *
   * @param config configuration; must not be {@code null}
   */
  public BackStackFactory(BackStackConfig config) {
    this(config, null);
  }

  /**
   * Creates a factory with an explicit metrics port.
   *
   * @param config configuration; must not be {@code null}
   * @param metrics metrics port to use; {@code null} selects one from {@link BackStackConfig#metricsEnabled()}
   */
  public BackStackFactory(BackStackConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    this.metrics = metrics != null ? metrics : createMetrics(config);
    this.keys = createKeys(config);
    log.debug("Back stack factory ready (keys={}, duplicateKeys={}, metrics={})",
        config.keyStrategy(), config.duplicateKeys(), config.metricsEnabled());
  }

  /**
   * Creates an empty stack of {@link StackRecord}s configured by this factory.
   *
   * @return new stack
   */
  public ObservableBackStack<StackRecord> newBackStack() {
    return new ObservableBackStack<>(
        destination -> new StackRecord(keys.nextKey(), destination),
        metrics,
        config.duplicateKeys(),
        config.initialCapacity());
  }

  /**
   * Creates a stack holding {@code root} as its only record.
   *
   * @param root root destination; must not be {@code null}
   * @return new stack at its root
   */
  public ObservableBackStack<StackRecord> newBackStack(Destination root) {
    ObservableBackStack<StackRecord> stack = newBackStack();
    stack.push(Objects.requireNonNull(root, "root"));
    return stack;
  }

  /**
   * Creates a navigator over {@code backStack} sharing this factory's metrics.
   *
   * @param backStack stack to drive
   * @param onRootPop invoked when back is requested at the root
   * @param <R> record type
   * @return new navigator
   */
  public <R extends BackStack.Record> BackStackNavigator<R> newNavigator(
      BackStack<R> backStack, Consumer<? super Destination> onRootPop) {
    return new BackStackNavigator<>(backStack, onRootPop, metrics);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public KeyGenerator keys() {
    return keys;
  }

  public BackStackConfig config() {
    return config;
  }

  private static MetricsPort createMetrics(BackStackConfig config) {
    if (!config.metricsEnabled()) {
      return MetricsPort.NO_OP;
    }
    return new OpenTelemetryMetricsAdapter();
  }

  private static KeyGenerator createKeys(BackStackConfig config) {
    return switch (config.keyStrategy()) {
      case ULID -> KeyGenerator.ULID;
      case SEQUENTIAL -> new SequentialKeyGenerator(config.keyPrefix());
    };
  }
}
