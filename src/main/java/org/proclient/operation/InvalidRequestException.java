package org.proclient.operation;

/**
 * Thrown when a request is malformed before any validation against the catalog can happen,
 * e.g. when enable or disable is called without service names.
 */
public class InvalidRequestException extends Exception {

    private final Message reason;

    /**
     * Creates a new InvalidRequestException.
     *
     * @param reason The message describing the problem.
     * @param args   Values for the message template.
     */
    public InvalidRequestException(final Message reason, final Object... args) {
        super(reason.format(args));
        this.reason = reason;
    }

    public Message getReason() {
        return reason;
    }

    /**
     * Converts this exception into the batch-level error reported to the user.
     *
     * @return A system error entry carrying the message code.
     */
    public ErrorEntry toErrorEntry() {
        return ErrorEntry.system(reason.code(), getMessage());
    }
}
