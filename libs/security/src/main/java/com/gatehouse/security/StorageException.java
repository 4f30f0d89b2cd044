package com.gatehouse.security;

/**
 * Thrown by a {@link UserStore} when the backing store cannot be reached or queried.
 * <p>
 * Distinct from "not found": this is a server-side fault and is never reported to the client as
 * an authentication failure.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
