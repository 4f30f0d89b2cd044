package com.gatehouse.api.infrastructure.web;

import com.gatehouse.security.AccessDenial;

/**
 * Raised when an access guard denies a request, so that the denial can abort handler argument
 * resolution and reach {@link GlobalExceptionHandler}.
 */
public class AccessDeniedException extends RuntimeException {

    private final transient AccessDenial denial;

    public AccessDeniedException(AccessDenial denial) {
        super(denial.reason().tag() + ": " + denial.message());
        this.denial = denial;
    }

    public AccessDenial denial() {
        return denial;
    }
}
