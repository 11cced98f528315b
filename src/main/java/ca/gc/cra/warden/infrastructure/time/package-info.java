/**
 * Clock adapters implementing {@link ca.gc.cra.warden.application.port.ClockPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.time;
