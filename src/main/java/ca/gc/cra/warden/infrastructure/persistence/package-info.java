/**
 * File-backed persistence of authentication session state.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.persistence;
