package com.phillippitts.callrelay.protocol.outbound;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Operator instruction addressed to one device rather than to a call.
 *
 * @param command free-form command name understood by the device app
 * @param data    command arguments, omitted when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "command", "data"})
public record DeviceCommandMessage(String type, String command, JsonNode data) implements OutboundMessage {

    public static final String TYPE = "command";

    public DeviceCommandMessage(String command, JsonNode data) {
        this(TYPE, command, data);
    }
}
