package com.gatehouse.api.infrastructure.web;

import com.gatehouse.security.Scope;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link com.gatehouse.security.Principal} handler parameter as the caller, resolved by
 * an access guard requiring the given scopes.
 *
 * <pre>
 * &#64;GetMapping
 * UserView current(&#64;CurrentUser(Scope.USER_READ) Principal user) { ... }
 * </pre>
 *
 * <p>Declare it before any {@code @RequestBody} parameter so that unauthenticated requests are
 * rejected before the body is read.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CurrentUser {

    /** Scopes the bearer token must grant. Superusers satisfy any scope. */
    Scope[] value() default {};

    /** Whether the principal's status must be {@code active}. */
    boolean requireActive() default true;
}
