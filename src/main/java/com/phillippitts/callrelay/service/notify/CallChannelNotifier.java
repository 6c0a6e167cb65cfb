package com.phillippitts.callrelay.service.notify;

import com.phillippitts.callrelay.domain.CallSession;
import com.phillippitts.callrelay.domain.CallStatus;
import com.phillippitts.callrelay.exception.ExternalCapabilityException;
import com.phillippitts.callrelay.service.call.event.CallSummarizedEvent;
import com.phillippitts.callrelay.service.call.event.CallUpdatedEvent;
import com.phillippitts.callrelay.service.capability.CapabilityInvoker;
import com.phillippitts.callrelay.service.capability.CapabilityNames;
import com.phillippitts.callrelay.service.capability.ChannelNotifier;
import com.phillippitts.callrelay.util.DurationFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Forwards call lifecycle events to the chat channel.
 *
 * <p>Notifications are sent on the pipeline pool through {@link CapabilityInvoker}, so a slow
 * or failing channel never delays call processing. Failures are logged and dropped.
 */
@Component
public class CallChannelNotifier {

    private static final Logger LOG = LogManager.getLogger(CallChannelNotifier.class);

    private final ChannelNotifier notifier;
    private final ImportancePolicy policy;
    private final CapabilityInvoker invoker;
    private final Executor executor;

    public CallChannelNotifier(ChannelNotifier notifier,
                               ImportancePolicy policy,
                               CapabilityInvoker invoker,
                               @Qualifier("pipelineExecutor") Executor executor) {
        this.notifier = Objects.requireNonNull(notifier);
        this.policy = Objects.requireNonNull(policy);
        this.invoker = Objects.requireNonNull(invoker);
        this.executor = Objects.requireNonNull(executor);
    }

    @EventListener
    public void onCallUpdated(CallUpdatedEvent event) {
        CallSession call = event.session();
        if (event.isRegistration()) {
            forward(ChannelNotificationKind.REGISTERED, call);
        } else if (call.status() == CallStatus.ANSWERED) {
            forward(ChannelNotificationKind.ANSWERED, call);
        } else if (call.status() == CallStatus.ENDED) {
            forward(ChannelNotificationKind.ENDED, call);
        }
    }

    @EventListener
    public void onCallSummarized(CallSummarizedEvent event) {
        forward(ChannelNotificationKind.SUMMARY, event.session());
    }

    static String render(ChannelNotificationKind kind, CallSession call) {
        String direction = call.incoming() ? "Incoming" : "Outgoing";
        String party = (call.incoming() ? "From: " : "To: ") + call.phoneNumber();
        long seconds = call.durationSeconds() == null ? 0 : call.durationSeconds();
        switch (kind) {
            case REGISTERED:
                return direction + " call\n" + party + "\nID: " + call.callId();
            case ANSWERED:
                return "Call answered\n" + party + "\nID: " + call.callId();
            case ENDED:
                return "Call ended\n" + party + "\nDuration: " + DurationFormatter.format(seconds);
            case SUMMARY:
                return "Call summary\n" + party + "\nDuration: " + DurationFormatter.format(seconds)
                        + "\n\n" + call.summary();
            default:
                throw new IllegalArgumentException("Unknown notification kind: " + kind);
        }
    }

    private void forward(ChannelNotificationKind kind, CallSession call) {
        if (!policy.shouldForward(kind, call)) {
            LOG.debug("Channel notification {} for call {} filtered by policy", kind, call.callId());
            return;
        }
        String message = render(kind, call);
        try {
            executor.execute(() -> send(kind, call.callId(), message));
        } catch (RejectedExecutionException e) {
            LOG.warn("Channel notification {} for call {} dropped, pool saturated", kind, call.callId());
        }
    }

    private void send(ChannelNotificationKind kind, String callId, String message) {
        try {
            invoker.invoke(CapabilityNames.NOTIFY, callId, () -> {
                notifier.notifyChannel(message);
                return Boolean.TRUE;
            });
        } catch (ExternalCapabilityException e) {
            LOG.warn("Channel notification {} for call {} failed: {}", kind, callId, e.getMessage());
        }
    }
}
