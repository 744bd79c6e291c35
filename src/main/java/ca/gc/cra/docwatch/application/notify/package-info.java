/**
 * Mail template validation and rendering for reminder and test notifications.
 */
package ca.gc.cra.docwatch.application.notify;
