/**
 * Key generator adapters for records minted from bare destinations.
 * <p>The default ULID-style generator lives on {@link ca.gc.cra.backstack.application.port.KeyGenerator#ULID}.</p>
 */
package ca.gc.cra.backstack.infrastructure.keys;
