/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep secrets out of log output.
 * <p><strong>Role:</strong> Cross-cutting support for the session orchestrator, strategies, and transports.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Provides redaction helpers so passwords and tokens never reach operator logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.logging;
