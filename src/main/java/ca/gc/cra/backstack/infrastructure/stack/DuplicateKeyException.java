package ca.gc.cra.backstack.infrastructure.stack;

/**
 * Thrown under {@link DuplicateKeyPolicy#FAIL} when a push would put two records with the same key on a stack.
 *
 * @since 0.1.0
 */
public final class DuplicateKeyException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String key;

  /**
   * Creates an exception naming the duplicated key.
   *
   * @param key key already present on the stack
   */
  public DuplicateKeyException(String key) {
    super("Record key already present on back stack: " + key);
    this.key = key;
  }

  public String key() {
    return key;
  }
}
