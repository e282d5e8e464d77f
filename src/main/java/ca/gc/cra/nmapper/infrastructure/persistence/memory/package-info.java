/**
 * Volatile snapshot store.
 */
package ca.gc.cra.nmapper.infrastructure.persistence.memory;
