/**
 * Typed logging configuration, YAML and environment loaders, and the {@code BeaconRuntime} composition root.
 * <p><strong>Role:</strong> Bootstrap layer turning flat dotted keys into immutable records.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable; the runtime guards lazy state with a lock.</p>
 * <p><strong>Security:</strong> Paths and logger names pass through {@code ca.gc.cra.beacon.validation}.</p>
 */
package ca.gc.cra.beacon.config;
