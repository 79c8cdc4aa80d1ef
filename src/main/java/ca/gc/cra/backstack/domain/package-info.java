/**
 * Core domain model for back stack navigation.
 * <p><strong>Role:</strong> Domain layer types describing destinations, records, and history without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain operations feed the {@code backstack.*} metrics emitted by adapters.</p>
 */
package ca.gc.cra.backstack.domain;
