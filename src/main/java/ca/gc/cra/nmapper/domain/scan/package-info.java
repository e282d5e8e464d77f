/**
 * Scan request vocabulary: validated targets and scan profiles.
 */
package ca.gc.cra.nmapper.domain.scan;
