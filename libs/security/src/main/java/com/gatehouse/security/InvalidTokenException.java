package com.gatehouse.security;

/**
 * Thrown by {@link TokenCodec#decode(String)} when a token is malformed, carries a bad
 * signature or an unexpected algorithm, lacks required claims, or has expired.
 */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
