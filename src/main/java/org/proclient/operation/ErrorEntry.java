package org.proclient.operation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One error or warning in an {@link OperationResult}.
 *
 * @param message     The human-readable message, possibly spanning several lines.
 * @param messageCode The stable identifier of the message template.
 * @param service     The service the entry is attributed to, or null for batch-level entries.
 * @param type        Whether the entry concerns the whole batch or one service.
 */
@JsonPropertyOrder({"message", "message_code", "service", "type"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ErrorEntry(
    @JsonProperty("message") String message,
    @JsonProperty("message_code") String messageCode,
    @JsonProperty("service") String service,
    @JsonProperty("type") ErrorType type
) {
    public ErrorEntry {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(messageCode, "messageCode");
        Objects.requireNonNull(type, "type");
    }

    public static ErrorEntry system(final String messageCode, final String message) {
        return new ErrorEntry(message, messageCode, null, ErrorType.SYSTEM);
    }

    public static ErrorEntry service(final String service, final String messageCode, final String message) {
        return new ErrorEntry(message, messageCode, Objects.requireNonNull(service, "service"), ErrorType.SERVICE);
    }
}
