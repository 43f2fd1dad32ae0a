package org.proclient.operation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scope of an {@link ErrorEntry}: the whole batch or a single service.
 */
public enum ErrorType {
    SYSTEM("system"),
    SERVICE("service");

    private final String value;

    ErrorType(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
