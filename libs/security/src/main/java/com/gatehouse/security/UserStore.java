package com.gatehouse.security;

import java.util.Optional;

/**
 * Port to the persistence store that owns principal records.
 *
 * <p>Implementations report a missing user as {@link Optional#empty()} and reserve
 * {@link StorageException} for transport or connection failures, so that callers can tell a
 * server fault from a failed login.
 */
@FunctionalInterface
public interface UserStore {

    /**
     * Looks up a principal by id.
     *
     * @param id the user id
     * @return the principal, or empty if no such user exists
     * @throws StorageException if the store could not be queried
     */
    Optional<Principal> get(String id);
}
