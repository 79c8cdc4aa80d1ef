package ca.gc.cra.backstack.domain.nav;

/**
 * <strong>What:</strong> Marker for an opaque destination descriptor (the thing a navigator presents).
 * <p><strong>Why:</strong> Lets the back stack carry application screens without depending on them.</p>
 * <p><strong>Role:</strong> Domain marker implemented by application-defined screen types.</p>
 * <p><strong>Thread-safety:</strong> Implementations should be immutable; the stack shares references freely.</p>
 *
 * @implNote The stack never inspects a destination; equality is the caller's concern.
 * @since 0.1.0
 */
public interface Destination {}
