package org.proclient.operation;

/**
 * Lifecycle actions the client can perform.
 */
public enum Action {
    ENABLE("enable", true),
    DISABLE("disable", true),
    ATTACH("attach", false),
    DETACH("detach", false),
    REFRESH("refresh", false);

    private final String verb;
    private final boolean batch;

    Action(final String verb, final boolean batch) {
        this.verb = verb;
        this.batch = batch;
    }

    /**
     * The verb as typed on the command line and used in messages.
     *
     * @return e.g. "enable".
     */
    public String verb() {
        return verb;
    }

    /**
     * Whether the action takes a list of service names and must pass the attachment gate
     * before any per-service work.
     *
     * @return true for enable and disable.
     */
    public boolean isBatch() {
        return batch;
    }
}
