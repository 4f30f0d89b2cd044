package com.gatehouse.security;

import java.util.Arrays;
import java.util.Collection;

/**
 * Builds {@link AccessGuard} instances that share one token codec and user store.
 *
 * <p>Routes ask for a guard once, with the scopes they require, and reuse it for every request.
 */
public final class AccessGuardFactory {

    private final TokenCodec tokenCodec;
    private final UserStore userStore;

    public AccessGuardFactory(TokenCodec tokenCodec, UserStore userStore) {
        if (tokenCodec == null || userStore == null) {
            throw new IllegalArgumentException("tokenCodec and userStore must not be null");
        }
        this.tokenCodec = tokenCodec;
        this.userStore = userStore;
    }

    /** A guard that checks the token and scopes but accepts inactive principals. */
    public AccessGuard requiring(Scope... scopes) {
        return requiring(Arrays.asList(scopes));
    }

    public AccessGuard requiring(Collection<Scope> scopes) {
        return new AccessGuard(tokenCodec, userStore, scopes, false);
    }

    /** A guard that additionally rejects principals whose status is not active. */
    public AccessGuard requiringActive(Scope... scopes) {
        return requiringActive(Arrays.asList(scopes));
    }

    public AccessGuard requiringActive(Collection<Scope> scopes) {
        return new AccessGuard(tokenCodec, userStore, scopes, true);
    }
}
