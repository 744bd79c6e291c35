/**
 * Metrics adapter bridging the DOCWATCH {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes under the {@code delivery.*}, {@code reminder.*}, and {@code report.*}
 * namespaces.</p>
 * <p><strong>Security:</strong> Only counts and latencies are exported; no document or address data.</p>
 */
package ca.gc.cra.docwatch.infrastructure.metrics;
