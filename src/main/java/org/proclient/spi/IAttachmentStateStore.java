package org.proclient.spi;

import org.proclient.state.AttachmentState;
import org.proclient.state.StateStoreException;

/**
 * Persistent storage for the machine's {@link AttachmentState}.
 * <p>
 * Callers read the state once at the start of an invocation and write it at most once at
 * the end. Mutual exclusion between concurrent invocations is the caller's responsibility.
 */
public interface IAttachmentStateStore {

    /**
     * Reads the current attachment state.
     *
     * @return The persisted state, or {@link AttachmentState#unattached()} if nothing was persisted yet.
     * @throws StateStoreException if the state exists but cannot be read.
     */
    AttachmentState load();

    /**
     * Replaces the persisted attachment state.
     *
     * @param state The new state.
     * @throws StateStoreException if the state cannot be written.
     */
    void save(AttachmentState state);
}
