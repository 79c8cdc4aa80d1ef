/**
 * <strong>Purpose:</strong> Ports around the back stack: navigation intents in, change notifications, metrics,
 * and key minting out.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.backstack.application.port;
