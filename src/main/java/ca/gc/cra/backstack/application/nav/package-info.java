/**
 * Navigation controller layer: navigation events and the navigator that maps them onto a back stack.
 * <p><strong>Concurrency:</strong> Inherits the guarantees of the wrapped stack.</p>
 */
package ca.gc.cra.backstack.application.nav;
