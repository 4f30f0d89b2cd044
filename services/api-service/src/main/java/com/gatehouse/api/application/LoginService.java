package com.gatehouse.api.application;

import com.gatehouse.api.config.SecurityProperties;
import com.gatehouse.api.domain.AccessToken;
import com.gatehouse.api.error.ApiException;
import com.gatehouse.security.BearerTokenExtractor;
import com.gatehouse.security.CredentialAuthenticator;
import com.gatehouse.security.Principal;
import com.gatehouse.security.ScopeChecker;
import com.gatehouse.security.StorageException;
import com.gatehouse.security.TokenCodec;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * OAuth2 password flow: verifies credentials and issues a bearer token carrying the requested
 * scopes that the user holds.
 */
@Service
public class LoginService {

    private static final Logger log = LoggerFactory.getLogger(LoginService.class);

    static final String INVALID_CREDENTIALS = "unable to validate credentials";

    private final CredentialAuthenticator authenticator;
    private final TokenCodec tokenCodec;
    private final AuthMetrics metrics;
    private final Duration tokenLifetime;

    public LoginService(
            CredentialAuthenticator authenticator,
            TokenCodec tokenCodec,
            AuthMetrics metrics,
            SecurityProperties properties) {
        this.authenticator = authenticator;
        this.tokenCodec = tokenCodec;
        this.metrics = metrics;
        this.tokenLifetime = properties.token().expiry();
    }

    /**
     * @param username user id
     * @param password plaintext password
     * @param scope space-separated requested scopes, may be null
     * @return a bearer token for the user
     * @throws ApiException 401 on bad credentials, 500 if the user store is unavailable
     */
    public AccessToken login(String username, String password, String scope) {
        return metrics.timeLogin(() -> doLogin(username, password, scope));
    }

    private AccessToken doLogin(String username, String password, String scope) {
        Optional<Principal> principal;
        try {
            principal = authenticator.authenticate(username, password);
        } catch (StorageException e) {
            metrics.recordLogin(AuthMetrics.OUTCOME_ERROR);
            throw ApiException.database(INVALID_CREDENTIALS, Map.of("username", username), e);
        }
        if (principal.isEmpty()) {
            metrics.recordLogin(AuthMetrics.OUTCOME_FAILURE);
            log.info("Login failed for user={}", username);
            throw ApiException.unauthorized(INVALID_CREDENTIALS, BearerTokenExtractor.SCHEME);
        }

        List<String> requested = ScopeChecker.parse(scope);
        List<String> granted = ScopeChecker.grant(principal.get(), requested);
        String token = tokenCodec.issue(principal.get().id(), granted, tokenLifetime);

        metrics.recordLogin(AuthMetrics.OUTCOME_SUCCESS);
        log.info("Issued token for user={} scopes={} (requested {})", principal.get().id(), granted, requested);
        return AccessToken.bearer(token);
    }
}
