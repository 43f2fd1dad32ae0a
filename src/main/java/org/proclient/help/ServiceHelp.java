package org.proclient.help;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Help content for one service.
 *
 * @param name      The service name.
 * @param available "yes" if the service can be used on this release, otherwise "no".
 * @param help      The service's help text.
 */
@JsonPropertyOrder({"name", "available", "help"})
public record ServiceHelp(
    @JsonProperty("name") String name,
    @JsonProperty("available") String available,
    @JsonProperty("help") String help
) {
}
