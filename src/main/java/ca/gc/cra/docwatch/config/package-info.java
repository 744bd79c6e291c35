/**
 * Configuration records, the YAML loader, and composition root wiring for DOCWATCH CLIs.
 * <p><strong>Role:</strong> Application bootstrap layer selecting ingest, mail, and report adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Relay passwords are redacted from {@code toString()} and never logged.</p>
 */
package ca.gc.cra.docwatch.config;
