/**
 * Apache Flink streaming host for the alert engine.
 *
 * <p>
 * This package wires the core engine into a Flink pipeline that consumes
 * market ticks from Kafka, evaluates alerts per ticker, debounces triggers
 * and publishes trigger batches back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.alertsentinel.flink.AlertSentinelJob}: main entry point</li>
 * <li>{@link com.alertsentinel.flink.AlertEvaluationFunction}: keyed alert
 * evaluation</li>
 * <li>{@link com.alertsentinel.flink.TriggerBatchFunction}: keyed
 * trailing-edge batching</li>
 * <li>{@link com.alertsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.alertsentinel.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertsentinel.flink;
