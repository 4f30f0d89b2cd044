package com.gatehouse.api.domain;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Map;

/**
 * A partial update of the current user. Null fields are left unchanged.
 *
 * @param name new display name, at least one character
 * @param email new email address, at least one character
 * @param status {@code active} or {@code inactive}
 * @param data replacement profile data
 */
public record UserUpdate(
        @Size(min = 1) String name,
        @Size(min = 1) String email,
        @Pattern(regexp = "active|inactive", message = "must be 'active' or 'inactive'") String status,
        Map<String, Object> data) {}
