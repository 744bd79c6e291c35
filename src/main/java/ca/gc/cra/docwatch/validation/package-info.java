/**
 * <strong>Purpose:</strong> Checks applied to relay hosts, ports, mailboxes, threshold values and output
 * paths while {@code config.yaml} and command options are read.
 * <p>Failures surface as {@link IllegalArgumentException}; the configuration loader collects their
 * messages into a single report.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.docwatch.validation;
