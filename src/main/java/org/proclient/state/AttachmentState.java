package org.proclient.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The machine's subscription attachment as persisted between invocations.
 * <p>
 * Instances are immutable; the {@code with*} methods return modified copies.
 *
 * @param attached        Whether the machine is attached to a subscription.
 * @param entitlements    Names of the services the subscription entitles.
 * @param enabledServices Names of the services currently enabled on this machine.
 * @param machineToken    The token issued by the contract server on attach, or null.
 * @param contractId      The contract the machine is attached to, or null.
 * @param accountName     The subscription account name, or null.
 * @param contractName    The subscription contract name, or null.
 */
public record AttachmentState(
    @JsonProperty("attached") boolean attached,
    @JsonProperty("entitlements") Set<String> entitlements,
    @JsonProperty("enabled_services") Set<String> enabledServices,
    @JsonProperty("machine_token") String machineToken,
    @JsonProperty("contract_id") String contractId,
    @JsonProperty("account_name") String accountName,
    @JsonProperty("contract_name") String contractName
) {
    @JsonCreator
    public AttachmentState {
        entitlements = entitlements == null ? Set.of() : copyOf(entitlements);
        enabledServices = enabledServices == null ? Set.of() : copyOf(enabledServices);
    }

    /**
     * The state of a machine that has never been attached.
     *
     * @return A detached state with no entitlements.
     */
    public static AttachmentState unattached() {
        return new AttachmentState(false, Set.of(), Set.of(), null, null, null, null);
    }

    public boolean isEntitledTo(final String serviceName) {
        return entitlements.contains(serviceName);
    }

    public boolean isEnabled(final String serviceName) {
        return enabledServices.contains(serviceName);
    }

    public AttachmentState withEnabledServices(final Collection<String> enabled) {
        return new AttachmentState(attached, entitlements, new LinkedHashSet<>(enabled), machineToken, contractId, accountName, contractName);
    }

    public AttachmentState withEntitlements(final Collection<String> entitled) {
        return new AttachmentState(attached, new LinkedHashSet<>(entitled), enabledServices, machineToken, contractId, accountName, contractName);
    }

    // Insertion order is kept so the persisted file stays stable across rewrites.
    private static Set<String> copyOf(final Collection<String> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }
}
