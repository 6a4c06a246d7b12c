/**
 * Performance samples, statistics snapshots and sample queries.
 */
package ca.gc.cra.beacon.domain.perf;
