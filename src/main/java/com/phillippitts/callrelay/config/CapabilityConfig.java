package com.phillippitts.callrelay.config;

import com.phillippitts.callrelay.service.capability.ChannelNotifier;
import com.phillippitts.callrelay.service.capability.DisabledCallAssistant;
import com.phillippitts.callrelay.service.capability.LoggingChannelNotifier;
import com.phillippitts.callrelay.service.capability.ResponseCapability;
import com.phillippitts.callrelay.service.capability.SummaryCapability;
import com.phillippitts.callrelay.service.capability.TranscriptionCapability;
import com.phillippitts.callrelay.service.notify.ForwardAllImportancePolicy;
import com.phillippitts.callrelay.service.notify.ImportancePolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback capability beans. Any bean of the same type defined elsewhere wins.
 */
@Configuration
public class CapabilityConfig {

    private final DisabledCallAssistant disabledAssistant = new DisabledCallAssistant();

    @Bean
    @ConditionalOnMissingBean(TranscriptionCapability.class)
    public TranscriptionCapability transcriptionCapability() {
        return disabledAssistant::transcribe;
    }

    @Bean
    @ConditionalOnMissingBean(ResponseCapability.class)
    public ResponseCapability responseCapability() {
        return disabledAssistant::generateResponse;
    }

    @Bean
    @ConditionalOnMissingBean(SummaryCapability.class)
    public SummaryCapability summaryCapability() {
        return disabledAssistant::summarize;
    }

    @Bean
    @ConditionalOnMissingBean(ChannelNotifier.class)
    public ChannelNotifier channelNotifier() {
        return new LoggingChannelNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(ImportancePolicy.class)
    public ImportancePolicy importancePolicy() {
        return new ForwardAllImportancePolicy();
    }
}
