/**
 * Metrics adapters bridging {@link ca.gc.cra.fanout.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Adapters accept concurrent updates from every worker thread.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code fanout.host.*} and {@code fanout.dispatch.*} namespaces.</p>
 * <p><strong>Security:</strong> Only host outcome counts and latencies are exported; never remote output.</p>
 */
package ca.gc.cra.fanout.infrastructure.metrics;
