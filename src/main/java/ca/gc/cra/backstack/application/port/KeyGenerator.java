package ca.gc.cra.backstack.application.port;

import ca.gc.cra.backstack.domain.nav.RecordKeys;

/**
 * <strong>What:</strong> Port supplying fresh record keys when a bare destination is pushed.
 * <p><strong>Why:</strong> Keeps the key algorithm swappable; tests inject deterministic sequences.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Every key returned by one generator must differ from every other key it returned.
 * @since 0.1.0
 * @see ca.gc.cra.backstack.infrastructure.keys.SequentialKeyGenerator
 */
public interface KeyGenerator {
  /**
   * Returns a key never returned before by this generator.
   *
   * @return non-blank key
   */
  String nextKey();

  /**
   * Default generator minting ULID-style random keys via {@link RecordKeys#newKey()}.
   */
  KeyGenerator ULID = RecordKeys::newKey;
}
