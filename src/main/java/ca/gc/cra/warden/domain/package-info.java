/**
 * Core domain model for WARDEN client authentication sessions.
 * <p><strong>Role:</strong> Domain layer values describing connection status and credential material without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across threads.</p>
 * <p><strong>Security:</strong> Credential-bearing types redact secrets from {@code toString()}.</p>
 */
package ca.gc.cra.warden.domain;
