package org.proclient.operation;

/**
 * Thrown by a service action handler when the action cannot be applied to one service.
 * The failure is isolated to that service; the rest of the batch continues.
 */
public class ServiceExecutionException extends Exception {

    private final String serviceName;
    private final String messageCode;

    /**
     * Creates a new ServiceExecutionException from a message template.
     *
     * @param serviceName The service that failed.
     * @param reason      The message describing the failure.
     * @param args        Values for the message template.
     */
    public ServiceExecutionException(final String serviceName, final Message reason, final Object... args) {
        super(reason.format(args));
        this.serviceName = serviceName;
        this.messageCode = reason.code();
    }

    /**
     * Re-attributes a failure of a dependency to the service that needed it.
     *
     * @param serviceName The service whose action failed because of the dependency.
     * @param cause       The dependency's failure.
     */
    public ServiceExecutionException(final String serviceName, final ServiceExecutionException cause) {
        super(cause.getMessage(), cause);
        this.serviceName = serviceName;
        this.messageCode = cause.getMessageCode();
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getMessageCode() {
        return messageCode;
    }

    public ErrorEntry toErrorEntry() {
        return ErrorEntry.service(serviceName, messageCode, getMessage());
    }
}
