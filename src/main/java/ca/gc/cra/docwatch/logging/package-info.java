/**
 * <strong>Purpose:</strong> Logging setup (levels, file appenders) and log hygiene helpers.
 * <p><strong>Dependencies:</strong> SLF4J API with the Logback backend.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docwatch.logging;
