package com.phillippitts.callrelay.service.capability;

import com.phillippitts.callrelay.domain.AiResponseType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AssistantDirectiveTest {

    @Test
    void shouldTreatPlainReplyAsSpeech() {
        assertThat(AssistantDirective.parse("  Sure, one moment please. "))
                .contains(new AssistantDirective(AiResponseType.SPEAK, "Sure, one moment please."));
    }

    @Test
    void shouldRecognizeEndCallPrefix() {
        assertThat(AssistantDirective.parse("END_CALL: Goodbye!"))
                .contains(new AssistantDirective(AiResponseType.END_CALL, "Goodbye!"));
        assertThat(AssistantDirective.parse("end_call thanks"))
                .contains(new AssistantDirective(AiResponseType.END_CALL, "thanks"));
    }

    @Test
    void shouldAllowBareEndCall() {
        assertThat(AssistantDirective.parse("END_CALL"))
                .contains(new AssistantDirective(AiResponseType.END_CALL, ""));
    }

    @Test
    void shouldNotMatchEndCallInsideSentence() {
        assertThat(AssistantDirective.parse("Please do not END_CALL yet"))
                .map(AssistantDirective::type)
                .contains(AiResponseType.SPEAK);
    }

    @Test
    void shouldIgnoreBlankReplies() {
        assertThat(AssistantDirective.parse(null)).isEmpty();
        assertThat(AssistantDirective.parse("   ")).isEmpty();
    }
}
