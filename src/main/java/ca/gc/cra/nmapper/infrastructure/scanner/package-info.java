/**
 * Scanner adapters. The scan tool itself is an external command; see
 * {@link ca.gc.cra.nmapper.infrastructure.scanner.CommandScannerAdapter} for the output contract.
 */
package ca.gc.cra.nmapper.infrastructure.scanner;
