package com.gatehouse.security;

/**
 * A rejected request: the reason, the client-facing message, and the
 * {@code WWW-Authenticate} challenge to send back (null when no challenge applies).
 *
 * @param reason why access was denied
 * @param message client-facing message
 * @param challenge value for the {@code WWW-Authenticate} header, or null
 */
public record AccessDenial(DenialReason reason, String message, String challenge) {

    public AccessDenial {
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        if (message == null) {
            message = reason.defaultMessage();
        }
    }
}
