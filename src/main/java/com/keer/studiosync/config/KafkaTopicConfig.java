package com.keer.studiosync.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaTopicConfig {

    @Bean
    public NewTopic slotChangesTopic() {
        // keyed by date, so every change of one date lands on the same partition
        return TopicBuilder.name(KafkaConstants.TOPIC_SLOT_CHANGES).partitions(6).replicas(1).build();
    }
}
