package com.gatehouse.api.error;

import com.fasterxml.jackson.annotation.JsonValue;

/** Category of an {@link ApiError}, serialized in lowercase. */
public enum ErrorType {
    DATABASE("database"),
    INVALID_REQUEST("invalid_request"),
    UNAUTHORIZED("unauthorized"),
    NOT_FOUND("not_found");

    private final String value;

    ErrorType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
