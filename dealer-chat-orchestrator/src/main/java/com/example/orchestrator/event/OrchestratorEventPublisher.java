package com.example.orchestrator.event;

import com.example.orchestrator.config.OrchestratorProperties;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Fans events out to in-process listeners, then to Kafka keyed by conversation id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrchestratorEventPublisher {

    private final List<OrchestratorEventListener> listeners;
    private final KafkaTemplate<String, OrchestratorEvent> lifecycleKafkaTemplate;
    private final KafkaTemplate<String, MessageRecordedEvent> messageKafkaTemplate;
    private final OrchestratorProperties properties;

    public void publishLifecycleEvent(OrchestratorEvent event) {
        listeners.forEach(listener -> listener.onLifecycleEvent(event));
        lifecycleKafkaTemplate
                .send(properties.getKafka().getLifecycleTopic(), event.getConversationId(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to publish {} for conversation {}", event.getType(), event.getConversationId(), ex);
                    }
                });
    }

    public void publishMessageEvent(MessageRecordedEvent event) {
        listeners.forEach(listener -> listener.onMessageEvent(event));
        messageKafkaTemplate
                .send(properties.getKafka().getMessageTopic(), event.getConversationId(), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.warn("Failed to publish message {} for conversation {}",
                                event.getMessage() != null ? event.getMessage().getId() : null,
                                event.getConversationId(), ex);
                    }
                });
    }
}
