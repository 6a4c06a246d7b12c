/**
 * <strong>Purpose:</strong> Logback appenders, layouts and the SLF4J log sink.
 * <p><strong>Role:</strong> Adapter layer; renders text, colored text, JSON and structured JSON records and builds
 * console and rotating file appenders.
 * <p><strong>Concurrency:</strong> Layouts are stateless after start; appenders follow Logback's locking.
 * <p><strong>Observability:</strong> Correlation identifiers {@code user_id}, {@code session_id} and
 * {@code request_id} are read from SLF4J key/value pairs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.infrastructure.logging;
