/**
 * Authentication domain values: connection status, user credentials, and identity provider results.
 * <p><strong>Role:</strong> Domain layer inputs and outputs of the session orchestrator and its strategies.</p>
 * <p><strong>Concurrency:</strong> Enums and records are immutable and safe to share across threads.</p>
 * <p><strong>Metrics:</strong> {@link ca.gc.cra.warden.domain.auth.ConnectionStatus} names drive {@code auth.status.*}
 * counters.</p>
 * <p><strong>Security:</strong> Passwords and access tokens never appear in {@code toString()} output.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.domain.auth;
