package org.proclient.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.proclient.operation.OperationResult;

import java.util.List;

/**
 * Snapshot of the machine's subscription and service states.
 *
 * @param attached       Whether the machine is attached.
 * @param account        The account name, or null.
 * @param contract       The contract name, or null.
 * @param release        The release the machine runs, e.g. "22.04 (jammy)".
 * @param rebootRequired Whether the package manager asked for a reboot.
 * @param services       One entry per visible service, in catalog order.
 */
@JsonPropertyOrder({"_schema_version", "attached", "account", "contract", "release", "reboot_required", "services"})
public record StatusReport(
    @JsonProperty("attached") boolean attached,
    @JsonProperty("account") String account,
    @JsonProperty("contract") String contract,
    @JsonProperty("release") String release,
    @JsonProperty("reboot_required") boolean rebootRequired,
    @JsonProperty("services") List<ServiceStatusEntry> services
) {
    public StatusReport {
        services = List.copyOf(services);
    }

    @JsonProperty("_schema_version")
    public String schemaVersion() {
        return OperationResult.SCHEMA_VERSION;
    }
}
