/**
 * Metrics adapter bridging the Beacon metrics port to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for concurrent updates.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code beacon.} namespace.</p>
 */
package ca.gc.cra.beacon.infrastructure.metrics;
