/**
 * Core value types: log levels, typed attribute values and performance samples.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across threads.</p>
 */
package ca.gc.cra.beacon.domain;
