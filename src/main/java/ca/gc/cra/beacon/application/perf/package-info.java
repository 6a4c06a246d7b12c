/**
 * <strong>Purpose:</strong> In-memory recording of operation durations with tail statistics.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.beacon.application.perf.PerformanceTracker} is safe for concurrent
 * recording; the sample buffer serializes appends under one lock.
 * <p><strong>Performance:</strong> Appends are O(1); statistics copy and sort the filtered samples.
 * <p><strong>Observability:</strong> Publishes {@code performance.*} counters through the metrics port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.application.perf;
