package com.example.orchestrator.config;

import com.example.orchestrator.event.MessageRecordedEvent;
import com.example.orchestrator.event.OrchestratorEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, OrchestratorEvent> lifecycleProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties(null));
    }

    @Bean
    public KafkaTemplate<String, OrchestratorEvent> lifecycleKafkaTemplate(
            ProducerFactory<String, OrchestratorEvent> lifecycleProducerFactory) {
        return new KafkaTemplate<>(lifecycleProducerFactory);
    }

    @Bean
    public ProducerFactory<String, MessageRecordedEvent> messageProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties(null));
    }

    @Bean
    public KafkaTemplate<String, MessageRecordedEvent> messageKafkaTemplate(
            ProducerFactory<String, MessageRecordedEvent> messageProducerFactory) {
        return new KafkaTemplate<>(messageProducerFactory);
    }

    @Bean
    public NewTopic lifecycleTopic(OrchestratorProperties properties) {
        return TopicBuilder.name(properties.getKafka().getLifecycleTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic messageTopic(OrchestratorProperties properties) {
        return TopicBuilder.name(properties.getKafka().getMessageTopic())
                .partitions(12)
                .replicas(1)
                .build();
    }
}
