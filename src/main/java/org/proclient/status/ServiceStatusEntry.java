package org.proclient.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of {@code pro status}.
 *
 * @param name        The service name.
 * @param entitled    "yes" or "no"; always "no" on an unattached machine.
 * @param status      "enabled", "disabled" or "n/a" when the service cannot be used here.
 * @param available   "yes" if the service is available on this release.
 * @param description The one-line description.
 */
@JsonPropertyOrder({"name", "entitled", "status", "available", "description"})
public record ServiceStatusEntry(
    @JsonProperty("name") String name,
    @JsonProperty("entitled") String entitled,
    @JsonProperty("status") String status,
    @JsonProperty("available") String available,
    @JsonProperty("description") String description
) {
}
