/**
 * <strong>Purpose:</strong> SMTP relay adapter built on Jakarta Mail.
 * <p><strong>Security:</strong> Passwords are passed to the mail session only; they are never logged.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docwatch.infrastructure.mail;
