/**
 * Application services built on the Beacon ports: performance tracking, request logging and training logging.
 * <p><strong>Role:</strong> Application layer; depends on domain types and ports only.</p>
 */
package ca.gc.cra.beacon.application;
