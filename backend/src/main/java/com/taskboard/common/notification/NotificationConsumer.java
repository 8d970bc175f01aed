package com.taskboard.common.notification;

import com.taskboard.config.KafkaConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Delivers queued notifications. Exceptions propagate to the container's error handler,
 * which retries and finally routes the record to the dead-letter topic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationConsumer {

    private final NotificationSender notificationSender;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
            topics = KafkaConfig.NOTIFICATIONS_TOPIC,
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "notificationListenerFactory"
    )
    public void consume(OutboundNotification notification) {
        log.debug("Delivering notification: kind={}, to={}", notification.getKind(), notification.getRecipientEmail());
        notificationSender.send(notification);
        meterRegistry.counter("taskboard.notifications.delivered", "kind", notification.getKind().name()).increment();
    }
}
