package com.gatehouse.api.application;

import com.gatehouse.api.domain.UserUpdate;
import com.gatehouse.api.domain.UserView;
import com.gatehouse.api.error.ApiException;
import com.gatehouse.api.infrastructure.persistence.JdbcUserRepository;
import com.gatehouse.security.Principal;
import com.gatehouse.security.PrincipalStatus;
import com.gatehouse.security.StorageException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Self-service updates of the current user's profile. Scopes and password are not editable here.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final JdbcUserRepository users;

    public UserService(JdbcUserRepository users) {
        this.users = users;
    }

    public UserView update(String id, UserUpdate update) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("id", id);
        input.put("user", update);

        Principal current;
        try {
            current = users.get(id).orElseThrow(() -> ApiException.notFound("user not found", input));
        } catch (StorageException e) {
            throw ApiException.database("unable to get current user", input, e);
        }

        Principal updated = new Principal(
                current.id(),
                update.name() != null ? update.name() : current.name(),
                update.email() != null ? update.email() : current.email(),
                update.status() != null ? parseStatus(update.status(), input) : current.status(),
                current.scopes(),
                current.hashedPassword(),
                update.data() != null ? update.data() : current.data());

        boolean found;
        try {
            found = users.update(updated);
        } catch (StorageException e) {
            throw ApiException.database("unable to update user", input, e);
        }
        if (!found) {
            throw ApiException.notFound("user not found", input);
        }
        if (current.status() != updated.status()) {
            log.info("User {} status changed from {} to {}", id, current.status().value(), updated.status().value());
        }
        return UserView.from(updated);
    }

    private static PrincipalStatus parseStatus(String status, Map<String, Object> input) {
        return PrincipalStatus.fromValue(status).orElseThrow(() -> ApiException.invalidRequest(
                "invalid user", input, Map.of("status", "must be one of: active, inactive")));
    }
}
