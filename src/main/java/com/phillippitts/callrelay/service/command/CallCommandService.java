package com.phillippitts.callrelay.service.command;

import com.phillippitts.callrelay.domain.CallSession;
import com.phillippitts.callrelay.exception.CallNotFoundException;
import com.phillippitts.callrelay.exception.DeliveryFailureException;
import com.phillippitts.callrelay.protocol.outbound.CallAiResponseMessage;
import com.phillippitts.callrelay.service.call.CallSessionStore;
import com.phillippitts.callrelay.service.connection.ConnectionRegistry;
import com.phillippitts.callrelay.service.observer.CallObserverFanout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;

/**
 * Sends operator commands to the device that owns a call.
 *
 * <p>Unlike assistant replies, an operator command fails loudly when the device cannot be
 * reached. Observers see the command only once the device has received it.
 */
@Service
public class CallCommandService {

    private static final Logger LOG = LogManager.getLogger(CallCommandService.class);

    private final CallSessionStore store;
    private final ConnectionRegistry registry;
    private final CallObserverFanout fanout;
    private final Clock clock;

    public CallCommandService(CallSessionStore store,
                              ConnectionRegistry registry,
                              CallObserverFanout fanout,
                              Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.registry = Objects.requireNonNull(registry);
        this.fanout = Objects.requireNonNull(fanout);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * @throws CallNotFoundException    if the call is unknown
     * @throws DeliveryFailureException if the owning device is not connected or the write fails
     */
    public CallAiResponseMessage sendCallCommand(String callId, CallCommand command) {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(command.command(), "command type must not be null");
        CallSession call = store.requireCall(callId);
        if (call.deviceId() == null) {
            throw new DeliveryFailureException("<none>", "call " + callId + " has no owning device");
        }
        String text = command.text() == null ? "" : command.text();
        CallAiResponseMessage message = new CallAiResponseMessage(
                callId, command.command(), text, clock.instant().toString());
        registry.sendOrThrow(call.deviceId(), message);
        LOG.info("Operator command {} sent to device {} for call {}",
                command.command().wireName(), call.deviceId(), callId);
        fanout.publish(callId, message);
        return message;
    }
}
