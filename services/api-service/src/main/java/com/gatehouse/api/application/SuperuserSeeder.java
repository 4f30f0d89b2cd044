package com.gatehouse.api.application;

import com.gatehouse.api.config.SecurityProperties;
import com.gatehouse.api.infrastructure.persistence.JdbcUserRepository;
import com.gatehouse.security.PasswordHasher;
import com.gatehouse.security.Principal;
import com.gatehouse.security.PrincipalStatus;
import com.gatehouse.security.Scope;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the configured superuser at startup when it does not exist yet. An existing account is
 * left untouched, including its password.
 */
@Component
public class SuperuserSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SuperuserSeeder.class);

    private final JdbcUserRepository users;
    private final PasswordHasher passwordHasher;
    private final SecurityProperties.Superuser superuser;

    public SuperuserSeeder(JdbcUserRepository users, PasswordHasher passwordHasher, SecurityProperties properties) {
        this.users = users;
        this.passwordHasher = passwordHasher;
        this.superuser = properties.superuser();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (users.get(superuser.id()).isPresent()) {
            log.debug("Superuser {} already exists", superuser.id());
            return;
        }
        users.insert(new Principal(
                superuser.id(),
                null,
                null,
                PrincipalStatus.ACTIVE,
                Set.of(Scope.SUPERUSER),
                passwordHasher.hash(superuser.password()),
                null));
        log.info("Created superuser {}", superuser.id());
        if (superuser.usesDefaultPassword()) {
            log.warn("Superuser {} has the default password; set gatehouse.security.superuser.password", superuser.id());
        }
    }
}
