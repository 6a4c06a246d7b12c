/**
 * HTTP request logging with header redaction and body truncation, plus a framework-neutral middleware hook.
 */
package ca.gc.cra.beacon.application.request;
