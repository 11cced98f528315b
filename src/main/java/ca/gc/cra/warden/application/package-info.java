/**
 * Application layer of WARDEN: session orchestration and the ports it depends on.
 * <p><strong>Role:</strong> Sits between the domain model and infrastructure adapters (transports, metrics,
 * persistence).</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application;
