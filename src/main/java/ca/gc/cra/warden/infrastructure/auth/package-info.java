/**
 * <strong>Purpose:</strong> Concrete authentication variants plugged into
 * {@link ca.gc.cra.warden.application.session.AuthenticationClient}.
 * <p><strong>Variants:</strong> anonymous (no credentials), password (username/password exchange, resumable with a
 * saved token), token (pre-issued bearer token).</p>
 * <p><strong>Failure mapping:</strong> the password variant ends a failed exchange in {@code FAILED}; the token
 * variant ends a rejected token in {@code DISCONNECTED}; both end in {@code DISCONNECTED} when credentials are
 * missing.</p>
 * <p><strong>Security:</strong> Persisted state carries the username and access token, never the password.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.auth;
