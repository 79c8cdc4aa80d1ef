package ca.gc.cra.backstack.infrastructure.stack;

import ca.gc.cra.backstack.application.port.BackStackListener;
import ca.gc.cra.backstack.application.port.MetricsPort;
import ca.gc.cra.backstack.domain.nav.BackStack;
import ca.gc.cra.backstack.domain.nav.BackStackSnapshot;
import ca.gc.cra.backstack.logging.Logs;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs back stack changes as structured lines and updates observability metrics.
 *
 * @param <R> record type
 * @since 0.1.0
 */
public final class LoggingBackStackListener<R extends BackStack.Record> implements BackStackListener<R> {
  private static final Logger log = LoggerFactory.getLogger(LoggingBackStackListener.class);
  private static final int DESTINATION_MAX_BYTES = 96;

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a logging listener using the supplied metrics port and prefix.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted metrics (e.g., {@code backstack.changes})
   */
  public LoggingBackStackListener(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix =
        metricPrefix == null || metricPrefix.isBlank() ? "backstack.changes" : metricPrefix.trim();
  }

  /**
   * Creates a logging listener using {@code backstack.changes} as the metric prefix.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingBackStackListener(MetricsPort metrics) {
    this(metrics, "backstack.changes");
  }

  @Override
  public void onChanged(BackStackSnapshot<R> snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    metrics.increment(metricPrefix + ".emitted");
    metrics.observe(metricPrefix + ".depth", snapshot.size());

    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("version=" + snapshot.version());
    joiner.add("change=" + snapshot.change());
    joiner.add("size=" + snapshot.size());
    snapshot.top().ifPresent(top -> {
      joiner.add("top=" + top.key());
      joiner.add("destination=" + Logs.describe(top.destination(), DESTINATION_MAX_BYTES));
    });
    if (snapshot.isAtRoot()) {
      joiner.add("atRoot=true");
    }

    log.info("backstack.change {}", joiner);
  }
}
