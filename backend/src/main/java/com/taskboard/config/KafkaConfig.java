package com.taskboard.config;

import com.taskboard.common.notification.OutboundNotification;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.TopicPartition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Kafka configuration for outbound notifications (invitation emails, assignment notices).
 * Records that keep failing are retried, then published to the dead-letter topic.
 */
@Configuration
@EnableKafka
public class KafkaConfig {

    public static final String NOTIFICATIONS_TOPIC = "workspace-notifications";
    public static final String NOTIFICATIONS_DLT_TOPIC = "workspace-notifications-dlt";

    private static final int PARTITIONS = 4;
    private static final long RETRY_INTERVAL_MS = 1000L;
    private static final long MAX_RETRIES = 3L;

    /**
     * Partitioned by recipient email. Retention: 48 hours.
     */
    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(NOTIFICATIONS_TOPIC)
                .partitions(PARTITIONS)
                .replicas(1)    // Single broker, so replication=1
                .config("retention.ms", String.valueOf(48 * 60 * 60 * 1000))
                .build();
    }

    /**
     * Same partition count as the main topic; the recoverer keeps the source partition.
     */
    @Bean
    public NewTopic notificationsDltTopic() {
        return TopicBuilder.name(NOTIFICATIONS_DLT_TOPIC)
                .partitions(PARTITIONS)
                .replicas(1)
                .config("retention.ms", String.valueOf(7 * 24 * 60 * 60 * 1000))  // 7 days
                .build();
    }

    @Bean
    public DefaultErrorHandler notificationErrorHandler(KafkaTemplate<String, OutboundNotification> kafkaTemplate) {
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate,
                (record, ex) -> new TopicPartition(NOTIFICATIONS_DLT_TOPIC, record.partition()));
        return new DefaultErrorHandler(recoverer, new FixedBackOff(RETRY_INTERVAL_MS, MAX_RETRIES));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, OutboundNotification> notificationListenerFactory(
            ConsumerFactory<String, OutboundNotification> consumerFactory,
            DefaultErrorHandler notificationErrorHandler) {

        ConcurrentKafkaListenerContainerFactory<String, OutboundNotification> factory =
                new ConcurrentKafkaListenerContainerFactory<>();

        factory.setConsumerFactory(consumerFactory);
        factory.setConcurrency(2);
        factory.setCommonErrorHandler(notificationErrorHandler);

        return factory;
    }
}
