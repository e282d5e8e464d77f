/**
 * Kafka publishing of monitor notifications. Payloads are JSON strings keyed by snapshot or job id.
 *
 * @since 0.1.0
 */
package ca.gc.cra.nmapper.adapter.kafka;
