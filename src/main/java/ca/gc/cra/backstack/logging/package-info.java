/**
 * Logging helpers: bounded destination descriptions and runtime verbosity control over SLF4J/Logback.
 */
package ca.gc.cra.backstack.logging;
