/**
 * <strong>Purpose:</strong> Session orchestration: credential storage, status broadcasting, and the
 * {@link ca.gc.cra.warden.application.session.AuthenticationClient} lifecycle template.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.warden.application.session.StatusBroadcaster} is safe for
 * concurrent publish/subscribe; a client instance is meant for one logical session at a time.</p>
 * <p><strong>Observability:</strong> Lifecycle calls log at INFO, status transitions at DEBUG, and counters are
 * recorded under {@code auth.*}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.session;
