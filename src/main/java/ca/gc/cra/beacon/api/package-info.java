/**
 * Command-line entry points for the Beacon logging toolkit.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, merges configuration and runs the demo walkthrough.</p>
 * <p><strong>Concurrency:</strong> Commands run on the calling thread.</p>
 */
package ca.gc.cra.beacon.api;
