package org.proclient.contract;

import org.proclient.operation.ErrorEntry;
import org.proclient.operation.Message;

/**
 * Thrown when the contract server rejects a request or cannot be reached.
 */
public class ContractException extends Exception {

    private final Message reason;

    /**
     * Creates a new ContractException.
     *
     * @param reason The message reported to the user.
     * @param cause  The underlying failure, or null.
     * @param args   Values for the message template.
     */
    public ContractException(final Message reason, final Throwable cause, final Object... args) {
        super(reason.format(args), cause);
        this.reason = reason;
    }

    public Message getReason() {
        return reason;
    }

    public ErrorEntry toErrorEntry() {
        return ErrorEntry.system(reason.code(), getMessage());
    }
}
