/**
 * CLI entry points for the DOCWATCH commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, and invokes
 * use cases through the composition root.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths; relay passwords never reach console output.</p>
 */
package ca.gc.cra.docwatch.api;
