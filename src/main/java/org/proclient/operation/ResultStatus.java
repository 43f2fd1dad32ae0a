package org.proclient.operation;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall outcome of an operation.
 */
public enum ResultStatus {
    SUCCESS("success"),
    FAILURE("failure");

    private final String value;

    ResultStatus(final String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
