/**
 * Back stack adapters: the observable deque-backed stack, its synchronized decorator, and change listeners.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.backstack.infrastructure.stack.ObservableBackStack} is
 * single-writer; wrap it in {@link ca.gc.cra.backstack.infrastructure.stack.SynchronizedBackStack} for shared use.</p>
 * <p><strong>Metrics:</strong> Emits {@code backstack.*} counters and histograms through the metrics port.</p>
 */
package ca.gc.cra.backstack.infrastructure.stack;
