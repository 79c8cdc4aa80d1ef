/**
 * Navigation history model: destinations, keyed records, the back stack contract and its snapshots.
 * <p><strong>Role:</strong> Domain layer; no logging, metrics, or configuration dependencies.</p>
 * <p><strong>Concurrency:</strong> Records and snapshots are immutable; stacks document their own rules.</p>
 * <p><strong>Ordering:</strong> Every sequence exposed here is top-first.</p>
 */
package ca.gc.cra.backstack.domain.nav;
