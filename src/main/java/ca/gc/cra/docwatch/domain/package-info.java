/**
 * <strong>Purpose:</strong> Core DOCWATCH domain model: roster documents, expiry classification, and the
 * value types exchanged with the delivery dispatcher.
 * <p><strong>Concurrency:</strong> Value types are immutable records; {@code DocumentRecord} is mutated in
 * place by a single pipeline thread.
 * <p><strong>Dependencies:</strong> {@code java.time} only; no adapters or logging.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docwatch.domain;
