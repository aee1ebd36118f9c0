package com.zzf.eventsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.eventsync.bus.AuxiliaryEventBus;
import com.zzf.eventsync.dedup.EventDeduplicator;
import com.zzf.eventsync.event.DefaultEventValidator;
import com.zzf.eventsync.event.EventDecoder;
import com.zzf.eventsync.event.EventValidator;
import com.zzf.eventsync.metrics.EventPipelineMetrics;
import com.zzf.eventsync.ordering.EventOrderingBuffer;
import com.zzf.eventsync.pending.PendingPartsStore;
import com.zzf.eventsync.pipeline.EventPipeline;
import com.zzf.eventsync.pipeline.PipelineState;
import com.zzf.eventsync.router.StateContainers;
import com.zzf.eventsync.state.memory.InMemoryMessageStore;
import com.zzf.eventsync.state.memory.InMemoryPartStore;
import com.zzf.eventsync.state.memory.InMemoryPermissionRequestStore;
import com.zzf.eventsync.state.memory.InMemoryQuestionRequestStore;
import com.zzf.eventsync.state.memory.InMemorySessionStore;
import com.zzf.eventsync.transport.EventStreamDecoder;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(EventSyncProperties.class)
public class EventPipelineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock eventSyncClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineState pipelineState(EventSyncProperties props, Clock clock) {
        return new PipelineState(
                new EventDeduplicator(props.getDedupMaxSize()),
                new EventOrderingBuffer(props.getOrderingTimeoutMs(), props.getOrderingMaxQueueSize(), clock),
                new PendingPartsStore(props.getPendingPartsMaxPerMessage(), props.getPendingPartsMaxMessages()));
    }

    @Bean
    @ConditionalOnMissingBean
    public EventValidator eventValidator() {
        return new DefaultEventValidator();
    }

    @Bean
    public EventPipeline eventPipeline(PipelineState state, EventValidator validator, Clock clock, MeterRegistry registry) {
        return new EventPipeline(state, validator, new EventDecoder(clock), new EventPipelineMetrics(registry));
    }

    @Bean
    public InMemorySessionStore sessionStore() {
        return new InMemorySessionStore();
    }

    @Bean
    public InMemoryMessageStore messageStore() {
        return new InMemoryMessageStore();
    }

    @Bean
    public InMemoryPartStore partStore() {
        return new InMemoryPartStore();
    }

    @Bean
    public InMemoryPermissionRequestStore permissionRequestStore() {
        return new InMemoryPermissionRequestStore();
    }

    @Bean
    public InMemoryQuestionRequestStore questionRequestStore() {
        return new InMemoryQuestionRequestStore();
    }

    @Bean
    public AuxiliaryEventBus auxiliaryEventBus() {
        return new AuxiliaryEventBus();
    }

    @Bean
    public StateContainers stateContainers(InMemorySessionStore sessions,
                                           InMemoryMessageStore messages,
                                           InMemoryPartStore parts,
                                           InMemoryPermissionRequestStore permissions,
                                           InMemoryQuestionRequestStore questions,
                                           AuxiliaryEventBus auxiliary) {
        return StateContainers.builder()
                .sessions(sessions)
                .messages(messages)
                .parts(parts)
                .permissions(permissions)
                .questions(questions)
                .auxiliary(auxiliary)
                .build();
    }

    @Bean
    public EventStreamDecoder eventStreamDecoder(ObjectMapper objectMapper) {
        return new EventStreamDecoder(objectMapper);
    }
}
