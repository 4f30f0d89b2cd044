package com.gatehouse.api.domain;

import com.gatehouse.security.Principal;
import java.util.Map;

/**
 * The public view of a user: everything except scopes and the password hash.
 */
public record UserView(String id, String name, String email, String status, Map<String, Object> data) {

    public static UserView from(Principal principal) {
        return new UserView(
                principal.id(),
                principal.name(),
                principal.email(),
                principal.status().value(),
                principal.data());
    }
}
