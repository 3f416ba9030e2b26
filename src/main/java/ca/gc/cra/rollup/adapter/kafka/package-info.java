/**
 * Kafka adapters for the relay: a consumer-group reader for raw payloads and a producer for
 * compressed payloads.
 */
package ca.gc.cra.rollup.adapter.kafka;
