/**
 * <strong>Purpose:</strong> Ports defining the authentication session contracts.
 * <p><strong>Role:</strong> Application layer; strategies, transports, settings sources, and metrics adapters
 * implement these interfaces to plug into {@link ca.gc.cra.warden.application.session.AuthenticationClient}.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Ports exchanging credentials must never log secrets.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.port;
