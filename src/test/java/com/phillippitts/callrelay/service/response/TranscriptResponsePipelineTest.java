package com.phillippitts.callrelay.service.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.phillippitts.callrelay.domain.CallStatus;
import com.phillippitts.callrelay.service.call.event.CallSummarizedEvent;
import com.phillippitts.callrelay.testutil.FakeTransportHandle;
import com.phillippitts.callrelay.testutil.RelayTestFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TranscriptResponsePipelineTest {

    private RelayTestFixture fx;
    private FakeTransportHandle device;
    private FakeTransportHandle observer;

    @BeforeEach
    void setUp() {
        fx = new RelayTestFixture();
        device = fx.connect("d1");
        observer = fx.connect("o1");
        fx.store.registerCall("c1", "+15551234567", "d1", true);
        fx.fanout.subscribe("c1", "o1");
        device.clear();
        observer.clear();
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void speakInstructionGoesToDeviceAndObservers() {
        fx.responsePipeline.onTranscriptDelta("c1", "hello").join();

        JsonNode sent = device.lastMessage();
        assertThat(sent.get("type").asText()).isEqualTo("call_ai_response");
        assertThat(sent.get("responseType").asText()).isEqualTo("speak");
        assertThat(sent.get("text").asText()).isEqualTo("reply to hello");
        assertThat(observer.messagesOfType("call_ai_response")).hasSize(1);
    }

    @Test
    void deltaAnsweredAfterCallEndedSendsNothing() {
        fx.store.updateStatus("c1", CallStatus.ENDED);
        device.clear();
        observer.clear();

        fx.responsePipeline.onTranscriptDelta("c1", "too late").join();

        assertThat(fx.assistant.responseInputs()).isEmpty();
        assertThat(device.messagesOfType("call_ai_response")).isEmpty();
        assertThat(observer.messagesOfType("call_ai_response")).isEmpty();
    }

    @Test
    void endCallDirectiveIsForwarded() {
        fx.assistant.respondWith((delta, ctx) -> "END_CALL: Thanks for calling, goodbye.");

        fx.responsePipeline.onTranscriptDelta("c1", "that's all").join();

        JsonNode sent = device.lastMessage();
        assertThat(sent.get("responseType").asText()).isEqualTo("end_call");
        assertThat(sent.get("text").asText()).isEqualTo("Thanks for calling, goodbye.");
    }

    @Test
    void blankReplySendsNothing() {
        fx.assistant.respondWith((delta, ctx) -> " ");

        fx.responsePipeline.onTranscriptDelta("c1", "hmm").join();

        assertThat(device.frames()).isEmpty();
        assertThat(observer.frames()).isEmpty();
    }

    @Test
    void offlineDeviceStillReachesObservers() {
        fx.registry.unregister("d1");

        fx.responsePipeline.onTranscriptDelta("c1", "are you there").join();

        assertThat(device.frames()).isEmpty();
        assertThat(observer.messagesOfType("call_ai_response")).singleElement()
                .satisfies(n -> assertThat(n.get("text").asText()).isEqualTo("reply to are you there"));
    }

    @Test
    void responderFailureIsSkipped() {
        fx.assistant.respondWith((delta, ctx) -> {
            throw new IllegalStateException("model unavailable");
        });

        fx.responsePipeline.onTranscriptDelta("c1", "hello").join();

        assertThat(device.frames()).isEmpty();
        assertThat(fx.meterRegistry.get("callrelay.capability.failure")
                .tag("capability", "respond").counter().count()).isEqualTo(1.0);
    }

    @Test
    void responderSeesCallContext() {
        fx.responsePipeline.onTranscriptDelta("c1", "hello").join();

        assertThat(fx.assistant.contexts()).singleElement()
                .satisfies(ctx -> {
                    assertThat(ctx.callId()).isEqualTo("c1");
                    assertThat(ctx.phoneNumber()).isEqualTo("+15551234567");
                });
    }

    @Test
    void endedCallIsSummarizedExactlyOnce() {
        fx.store.appendTranscript("c1", "I need to reschedule");
        fx.store.updateStatus("c1", CallStatus.ENDED);

        assertThat(fx.assistant.summaryInputs()).containsExactly("I need to reschedule");
        assertThat(fx.store.requireCall("c1").summary()).isEqualTo("summary of I need to reschedule");
        List<JsonNode> summaries = observer.messagesOfType("call_summary");
        assertThat(summaries).singleElement()
                .satisfies(n -> assertThat(n.get("summary").asText()).isEqualTo("summary of I need to reschedule"));
        assertThat(fx.publisher.eventsOf(CallSummarizedEvent.class)).hasSize(1);
    }

    @Test
    void endedCallWithoutTranscriptIsNotSummarized() {
        fx.store.updateStatus("c1", CallStatus.ENDED);

        assertThat(fx.assistant.summaryInputs()).isEmpty();
        assertThat(observer.messagesOfType("call_summary")).isEmpty();
        assertThat(fx.store.requireCall("c1").summary()).isNull();
    }

    @Test
    void summaryFailureLeavesSessionEnded() {
        fx.assistant.summarizeWith((text, ctx) -> {
            throw new IllegalStateException("quota exceeded");
        });
        fx.store.appendTranscript("c1", "hello");

        fx.store.updateStatus("c1", CallStatus.ENDED);

        assertThat(fx.store.requireCall("c1").status()).isEqualTo(CallStatus.ENDED);
        assertThat(fx.store.requireCall("c1").summary()).isNull();
        assertThat(fx.publisher.eventsOf(CallSummarizedEvent.class)).isEmpty();
    }

    @Test
    void summaryIsForwardedToNotificationChannel() {
        fx.store.appendTranscript("c1", "billing question");
        fx.store.updateStatus("c1", CallStatus.ENDED);

        List<String> sent = fx.channel.messages();
        assertThat(sent.get(sent.size() - 1))
                .startsWith("Call summary")
                .endsWith("summary of billing question");
    }
}
