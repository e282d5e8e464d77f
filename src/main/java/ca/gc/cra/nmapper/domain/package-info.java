/**
 * Core domain model for the nmapper scan → snapshot → diff pipeline.
 * <p><strong>Role:</strong> Domain layer values describing devices, snapshots and diffs without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed {@code scheduler.*}, {@code monitor.*} and {@code store.*} metrics.</p>
 * <p><strong>Security:</strong> Inventory data (MAC addresses, banners) should be treated as internal.</p>
 */
package ca.gc.cra.nmapper.domain;
