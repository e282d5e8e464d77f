/**
 * Normalized network inventory primitives returned by scanner adapters (devices, ports, services).
 * <p><strong>Role:</strong> Domain inputs produced by {@code ScannerPort} implementations and compared by the diff engine.</p>
 * <p><strong>Concurrency:</strong> Immutable records; lists are defensively copied on construction.</p>
 */
package ca.gc.cra.nmapper.domain.network;
