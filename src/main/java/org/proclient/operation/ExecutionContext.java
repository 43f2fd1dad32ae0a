package org.proclient.operation;

import org.proclient.state.AttachmentState;
import org.proclient.system.ReleaseInfo;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable working copy of the machine's service state during one batch.
 * <p>
 * Handlers enable and disable services here instead of touching the persisted state. The
 * executor takes a {@link #checkpoint()} before each service and rolls back to it when the
 * service fails, so a failed service never leaves half-applied dependency changes behind.
 */
public final class ExecutionContext {

    private final AttachmentState initialState;
    private final ReleaseInfo release;
    private final boolean assumeYes;
    private final Set<String> enabled;
    private final Set<String> touched = new LinkedHashSet<>();

    public ExecutionContext(final AttachmentState initialState, final ReleaseInfo release, final boolean assumeYes) {
        this.initialState = initialState;
        this.release = release;
        this.assumeYes = assumeYes;
        this.enabled = new LinkedHashSet<>(initialState.enabledServices());
    }

    public ReleaseInfo release() {
        return release;
    }

    public boolean assumeYes() {
        return assumeYes;
    }

    public boolean isEntitledTo(final String service) {
        return initialState.isEntitledTo(service);
    }

    public boolean isEnabled(final String service) {
        return enabled.contains(service);
    }

    /**
     * Whether the service was enabled or disabled by an earlier step of this batch.
     *
     * @param service The service name.
     * @return true if this batch already changed the service.
     */
    public boolean wasChangedInBatch(final String service) {
        return touched.contains(service);
    }

    public void markEnabled(final String service) {
        enabled.add(service);
        touched.add(service);
    }

    public void markDisabled(final String service) {
        enabled.remove(service);
        touched.add(service);
    }

    public Checkpoint checkpoint() {
        return new Checkpoint(new LinkedHashSet<>(enabled), new LinkedHashSet<>(touched));
    }

    public void rollback(final Checkpoint checkpoint) {
        enabled.clear();
        enabled.addAll(checkpoint.enabled);
        touched.clear();
        touched.addAll(checkpoint.touched);
    }

    /**
     * The attachment state reflecting every change applied so far.
     *
     * @return The updated state.
     */
    public AttachmentState toState() {
        return initialState.withEnabledServices(enabled);
    }

    /**
     * Opaque snapshot of the working state.
     */
    public static final class Checkpoint {
        private final Set<String> enabled;
        private final Set<String> touched;

        private Checkpoint(final Set<String> enabled, final Set<String> touched) {
            this.enabled = enabled;
            this.touched = touched;
        }
    }
}
