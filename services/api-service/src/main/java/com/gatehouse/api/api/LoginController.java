package com.gatehouse.api.api;

import com.gatehouse.api.application.LoginService;
import com.gatehouse.api.domain.AccessToken;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * OAuth2 password-flow token endpoint.
 *
 * <pre>
 * POST /api/v1/login/token
 * Content-Type: application/x-www-form-urlencoded
 *
 * username=admin&amp;password=admin&amp;scope=user:read%20resources:read
 * </pre>
 *
 * <p>{@code grant_type} is accepted and ignored; {@code client_id} and {@code client_secret} are not
 * used.
 */
@RestController
@RequestMapping("/login")
public class LoginController {

    private final LoginService loginService;

    public LoginController(LoginService loginService) {
        this.loginService = loginService;
    }

    @PostMapping(path = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public AccessToken token(
            @RequestParam("username") String username,
            @RequestParam("password") String password,
            @RequestParam(name = "scope", required = false) String scope,
            @RequestParam(name = "grant_type", required = false) String grantType) {
        return loginService.login(username, password, scope);
    }
}
