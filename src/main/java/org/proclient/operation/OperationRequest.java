package org.proclient.operation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * One lifecycle request as parsed from the command line.
 *
 * @param action         The requested action.
 * @param requestedNames Service names, de-duplicated, in order of first occurrence.
 * @param assumeYes      Whether interactive confirmations are answered with yes.
 * @param format         How the result is rendered.
 * @param allowBeta      Whether beta services are treated as known.
 */
public record OperationRequest(
    Action action,
    List<String> requestedNames,
    boolean assumeYes,
    OutputFormat format,
    boolean allowBeta
) {
    public OperationRequest {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(format, "format");
        requestedNames = List.copyOf(new LinkedHashSet<>(requestedNames));
    }

    /**
     * Creates a validated request.
     *
     * @param action    The requested action.
     * @param names     Service names as given; blank entries and duplicates are dropped, the rest kept verbatim.
     * @param assumeYes Whether interactive confirmations are answered with yes.
     * @param format    How the result is rendered.
     * @param allowBeta Whether beta services are treated as known.
     * @return The request.
     * @throws InvalidRequestException if a batch action has no service names.
     */
    public static OperationRequest of(final Action action, final List<String> names, final boolean assumeYes,
                                      final OutputFormat format, final boolean allowBeta)
            throws InvalidRequestException {
        final List<String> cleaned = new ArrayList<>();
        if (names != null) {
            for (final String name : names) {
                if (name != null && !name.isBlank()) {
                    cleaned.add(name);
                }
            }
        }
        if (action.isBatch() && cleaned.isEmpty()) {
            throw new InvalidRequestException(Message.MISSING_SERVICE_NAME, action.verb());
        }
        return new OperationRequest(action, cleaned, assumeYes, format, allowBeta);
    }
}
