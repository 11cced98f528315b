/**
 * <strong>Purpose:</strong> Validation helpers used while building credentials, settings, and transport requests.
 * <p><strong>Role:</strong> Domain support; rejects invalid inputs before the client mutates state or opens a
 * network exchange.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Enforces printable ASCII constraints on values that end up in HTTP headers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.validation;
