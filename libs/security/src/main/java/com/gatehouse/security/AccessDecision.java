package com.gatehouse.security;

/**
 * Outcome of running an {@link AccessGuard}: exactly one of {@code principal} and
 * {@code denial} is set.
 *
 * @param principal the authorized principal, when granted
 * @param denial why access was refused, when denied
 */
public record AccessDecision(Principal principal, AccessDenial denial) {

    public AccessDecision {
        if ((principal == null) == (denial == null)) {
            throw new IllegalArgumentException("exactly one of principal and denial must be set");
        }
    }

    public static AccessDecision granted(Principal principal) {
        return new AccessDecision(principal, null);
    }

    public static AccessDecision denied(AccessDenial denial) {
        return new AccessDecision(null, denial);
    }

    public boolean isGranted() {
        return principal != null;
    }
}
