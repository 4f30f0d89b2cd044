package com.gatehouse.api.domain;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import java.util.UUID;

/**
 * A generic resource: an id, a name and free-form data.
 *
 * @param id resource id; generated on create when absent
 * @param name non-blank name
 * @param data free-form JSON object, may be null
 */
public record Resource(UUID id, @NotBlank String name, Map<String, Object> data) {

    public Resource withId(UUID newId) {
        return new Resource(newId, name, data);
    }
}
