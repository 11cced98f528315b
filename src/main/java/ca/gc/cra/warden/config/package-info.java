/**
 * Settings sources and the composition root wiring authentication clients.
 * <p><strong>Role:</strong> Bootstrap layer translating flat settings into strategies, transports, and metrics
 * adapters.</p>
 * <p><strong>Concurrency:</strong> Settings objects are immutable; safe to share between clients.</p>
 * <p><strong>Security:</strong> Settings may carry provider URLs but never passwords; credentials enter through
 * {@code AuthenticationClient.setCredentials}.</p>
 */
package ca.gc.cra.warden.config;
