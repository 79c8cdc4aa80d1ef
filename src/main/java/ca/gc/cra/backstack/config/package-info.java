/**
 * Configuration loading and composition for back stacks.
 * <p>YAML files are read with SnakeYAML; the {@code backstack} section overlays {@code common}.</p>
 */
package ca.gc.cra.backstack.config;
