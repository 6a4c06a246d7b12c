/**
 * Adapters binding Beacon ports to Logback, SLF4J and OpenTelemetry.
 */
package ca.gc.cra.beacon.infrastructure;
