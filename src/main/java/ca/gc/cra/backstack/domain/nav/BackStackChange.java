package ca.gc.cra.backstack.domain.nav;

/**
 * Kind of mutation that produced a {@link BackStackSnapshot}.
 *
 * @since 0.1.0
 */
public enum BackStackChange {
  /** Snapshot of a stack that has not been mutated yet. */
  INITIAL,
  /** A single record was pushed. */
  PUSH,
  /** A single record was popped. */
  POP,
  /** One or more records were removed by a predicate-driven unwind. */
  POP_UNTIL
}
