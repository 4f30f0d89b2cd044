package com.gatehouse.api.domain;

import java.util.Map;

/**
 * A partial resource update. Null fields keep their current value.
 */
public record ResourcePatch(String name, Map<String, Object> data) {

    public Resource applyTo(Resource current) {
        return new Resource(
                current.id(),
                name != null ? name : current.name(),
                data != null ? data : current.data());
    }
}
