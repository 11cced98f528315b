/**
 * Executor factories used for status dispatch.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.exec;
