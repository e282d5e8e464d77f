/**
 * Log-backed notification sink.
 */
package ca.gc.cra.nmapper.infrastructure.notify;
