/**
 * <strong>Purpose:</strong> Logger setup, presets and registry, plus payload helpers.
 * <p><strong>Concurrency:</strong> Setup methods are intended for startup; the registry is lock-guarded.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.beacon.logging;
