/**
 * Typed attribute values attached to log records.
 */
package ca.gc.cra.beacon.domain.value;
