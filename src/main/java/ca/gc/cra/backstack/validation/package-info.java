/**
 * Input validation helpers shared by the domain model and configuration layer.
 */
package ca.gc.cra.backstack.validation;
