package com.gatehouse.security;

/**
 * Why the access guard rejected a request.
 */
public enum DenialReason {

    /** No bearer token, or the Authorization header could not be read. */
    UNAUTHENTICATED("Not authenticated", false),

    /** Bad signature, malformed token, missing claims or expired. */
    INVALID_TOKEN("unable to validate credentials", false),

    /** The token's subject no longer exists. */
    PRINCIPAL_NOT_FOUND("unable to validate credentials", false),

    /** A required scope is not granted by the token. */
    INSUFFICIENT_PERMISSIONS("insufficient permissions", false),

    /** The principal exists but is not active. */
    INACTIVE_PRINCIPAL("unable to validate credentials", false),

    /** The user store failed while resolving the principal. */
    STORAGE_ERROR("unable to validate credentials", true);

    private final String defaultMessage;
    private final boolean serverFault;

    DenialReason(String defaultMessage, boolean serverFault) {
        this.defaultMessage = defaultMessage;
        this.serverFault = serverFault;
    }

    /** Client-facing message. Several reasons share one message so they cannot be told apart. */
    public String defaultMessage() {
        return defaultMessage;
    }

    /** True when the failure lies with the server rather than the caller's credentials. */
    public boolean serverFault() {
        return serverFault;
    }

    /** Lowercase name for metric tags and logs. */
    public String tag() {
        return name().toLowerCase();
    }
}
