/**
 * Application layer: ports and the navigation logic that drives a back stack from navigation intents.
 */
package ca.gc.cra.backstack.application;
