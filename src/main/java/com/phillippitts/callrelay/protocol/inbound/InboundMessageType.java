package com.phillippitts.callrelay.protocol.inbound;

import java.util.Arrays;
import java.util.Optional;

/**
 * Values of the {@code type} field accepted on the socket, each bound to its payload record.
 */
public enum InboundMessageType {
    INIT("init", DeviceInitMessage.class),
    PING("ping", PingMessage.class),
    CALL_REGISTER("call_register", CallRegisterMessage.class),
    CALL_STATUS("call_status", CallStatusMessage.class),
    CALL_AUDIO("call_audio", CallAudioMessage.class),
    CALL_OBSERVE("call_observe", CallObserveMessage.class),
    CALL_UNOBSERVE("call_unobserve", CallUnobserveMessage.class);

    private final String wireName;
    private final Class<? extends InboundMessage> payloadType;

    InboundMessageType(String wireName, Class<? extends InboundMessage> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends InboundMessage> payloadType() {
        return payloadType;
    }

    /**
     * Exact, case-sensitive match on the wire name.
     */
    public static Optional<InboundMessageType> fromWire(String raw) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(raw))
                .findFirst();
    }
}
