/**
 * Backend-neutral log severity.
 */
package ca.gc.cra.beacon.domain.log;
