/**
 * <strong>Purpose:</strong> Identity transports implementing {@link ca.gc.cra.warden.application.port.IdentityTransport}.
 * <p><strong>Adapters:</strong> {@link ca.gc.cra.warden.infrastructure.transport.HttpIdentityTransport} speaks JSON
 * over the JDK HTTP client; {@link ca.gc.cra.warden.infrastructure.transport.InMemoryIdentityTransport} serves tests
 * and offline wiring.</p>
 * <p><strong>Concurrency:</strong> Both adapters are safe for concurrent use by several clients.</p>
 * <p><strong>Security:</strong> Request bodies carrying passwords are never logged; error bodies are truncated.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.transport;
