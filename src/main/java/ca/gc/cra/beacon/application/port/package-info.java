/**
 * <strong>Purpose:</strong> Ports for log emission, metrics and time.
 * <p><strong>Role:</strong> Adapters implement these interfaces to plug in SLF4J, OpenTelemetry or test fakes.
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe unless documented otherwise.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.application.port;
