/**
 * Infrastructure adapters implementing back stack ports: stacks, key generators, and metrics exporters.
 * <p><strong>Observability:</strong> Adapters log through SLF4J and report through {@code MetricsPort}.</p>
 */
package ca.gc.cra.backstack.infrastructure;
