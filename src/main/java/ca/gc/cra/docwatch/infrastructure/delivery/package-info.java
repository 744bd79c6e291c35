/**
 * File-backed exports of delivery results.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docwatch.infrastructure.delivery;
