package org.proclient.operation;

import org.proclient.state.AttachmentState;

/**
 * Machine-level preconditions checked before any per-service work.
 * <p>
 * Enable and disable only make sense on an attached machine. When that does not hold the
 * whole batch is rejected with one synthesized error and no service is ever attempted.
 * Attach, detach and refresh have single-shot preconditions of their own.
 */
public final class PreconditionGate {

    /**
     * Evaluates the gate for a batch action.
     *
     * @param action    enable or disable.
     * @param state     The attachment state read at the start of the invocation.
     * @param partition The validated names.
     * @return proceed, or a blocked verdict carrying the composed error.
     */
    public GateVerdict evaluate(final Action action, final AttachmentState state, final ServiceNamePartition partition) {
        if (!action.isBatch()) {
            return evaluateSingleShot(action, state);
        }
        if (state.attached()) {
            return GateVerdict.proceed();
        }
        return GateVerdict.blocked(MessageComposer.blockedUnattached(action, partition));
    }

    /**
     * Evaluates the gate for attach, detach or refresh.
     *
     * @param action The single-shot action.
     * @param state  The attachment state read at the start of the invocation.
     * @return proceed, or a blocked verdict.
     */
    public GateVerdict evaluateSingleShot(final Action action, final AttachmentState state) {
        return switch (action) {
            case ATTACH -> state.attached()
                ? GateVerdict.blocked(Message.ALREADY_ATTACHED.asSystemError(accountLabel(state)))
                : GateVerdict.proceed();
            case DETACH, REFRESH -> state.attached()
                ? GateVerdict.proceed()
                : GateVerdict.blocked(Message.UNATTACHED.asSystemError());
            case ENABLE, DISABLE -> throw new IllegalArgumentException(action.verb() + " is a batch action");
        };
    }

    private static String accountLabel(final AttachmentState state) {
        return state.accountName() != null ? state.accountName() : "an Ubuntu Pro subscription";
    }
}
