/**
 * Infrastructure adapters for WARDEN: authentication strategies, identity transports, persistence, metrics,
 * executors, and clocks.
 * <p><strong>Role:</strong> Implements the application ports against external systems and libraries.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure;
