package com.gatehouse.api.api;

import com.gatehouse.api.application.UserService;
import com.gatehouse.api.domain.UserUpdate;
import com.gatehouse.api.domain.UserView;
import com.gatehouse.api.infrastructure.web.CurrentUser;
import com.gatehouse.security.Principal;
import com.gatehouse.security.Scope;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The authenticated user's own profile. Both routes require an active user holding
 * {@code user:read}; updates also need {@code user:write}.
 */
@RestController
@RequestMapping("/user")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping({"", "/"})
    public UserView current(@CurrentUser(Scope.USER_READ) Principal user) {
        return UserView.from(user);
    }

    @PatchMapping({"", "/"})
    public UserView update(
            @CurrentUser({Scope.USER_WRITE, Scope.USER_READ}) Principal user,
            @Valid @RequestBody UserUpdate update) {
        return userService.update(user.id(), update);
    }
}
