package com.taskboard.common.notification;

import com.taskboard.config.KafkaConfig;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * DLT (Dead Letter Topic) consumer for notifications that failed delivery after retries.
 * Makes one last delivery attempt and tracks the outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDltConsumer {

    private final NotificationSender notificationSender;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
            topics = KafkaConfig.NOTIFICATIONS_DLT_TOPIC,
            groupId = "${spring.kafka.consumer.group-id}-dlt"
    )
    public void handleFailedNotification(OutboundNotification notification) {
        log.warn("Reprocessing failed notification from DLT: kind={}, to={}, createdAt={}",
                notification.getKind(), notification.getRecipientEmail(), notification.getCreatedAt());

        try {
            notificationSender.send(notification);
            meterRegistry.counter("taskboard.notifications.dlt.recovered").increment();
            log.info("DLT redelivery success: kind={}, to={}", notification.getKind(), notification.getRecipientEmail());
        } catch (Exception e) {
            log.error("DLT redelivery failed, needs manual intervention: kind={}, to={}",
                    notification.getKind(), notification.getRecipientEmail(), e);
            meterRegistry.counter("taskboard.notifications.dlt.failed").increment();
            throw new NotificationDeliveryException("DLT redelivery failed", e);
        }
    }
}
