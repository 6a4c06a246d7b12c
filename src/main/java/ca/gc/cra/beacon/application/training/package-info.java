/**
 * Model training and model artifact event logging.
 */
package ca.gc.cra.beacon.application.training;
