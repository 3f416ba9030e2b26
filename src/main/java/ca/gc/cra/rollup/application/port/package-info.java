/**
 * Ports between the compression use cases and their adapters: payload sources, output
 * destinations, and metrics.
 */
package ca.gc.cra.rollup.application.port;
