package com.taskboard.common.notification;

import com.taskboard.config.KafkaConfig;
import com.taskboard.config.TaskboardProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;

/**
 * Publishes notifications to Kafka with a bounded synchronous send.
 * Failed sends go to an in-memory fallback queue that is retried on a schedule.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private final KafkaTemplate<String, OutboundNotification> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final TaskboardProperties properties;

    private final Queue<OutboundNotification> fallbackQueue = new ConcurrentLinkedQueue<>();

    @Override
    public DispatchResult dispatch(OutboundNotification notification) {
        try {
            send(notification);
            meterRegistry.counter("taskboard.notifications.queued", "kind", notification.getKind().name()).increment();
            log.debug("Notification queued: kind={}, to={}", notification.getKind(), notification.getRecipientEmail());
            return DispatchResult.QUEUED;
        } catch (Exception e) {
            log.error("Kafka publish failed, using fallback queue: kind={}, to={}",
                    notification.getKind(), notification.getRecipientEmail(), e);
            fallbackQueue.offer(notification);
            meterRegistry.counter("taskboard.notifications.fallback", "kind", notification.getKind().name()).increment();
            return DispatchResult.PENDING;
        }
    }

    /**
     * Retry publishing notifications from the fallback queue.
     * Stops on first failure to avoid hammering Kafka during an outage.
     */
    @Scheduled(fixedDelayString = "${app.notifications.retry-interval-ms:5000}")
    public void retryFallbackQueue() {
        if (fallbackQueue.isEmpty()) {
            return;
        }

        int retried = 0;
        int succeeded = 0;
        log.info("Retrying notification fallback queue, size: {}", fallbackQueue.size());

        OutboundNotification notification;
        while ((notification = fallbackQueue.poll()) != null) {
            retried++;
            try {
                send(notification);
                succeeded++;
                meterRegistry.counter("taskboard.notifications.fallback.success").increment();
            } catch (Exception e) {
                fallbackQueue.offer(notification);
                log.warn("Fallback retry failed, re-queued: kind={}, to={}, remaining={}",
                        notification.getKind(), notification.getRecipientEmail(), fallbackQueue.size());
                break;
            }
        }

        if (succeeded > 0) {
            log.info("Fallback retry completed: retried={}, succeeded={}, remaining={}",
                    retried, succeeded, fallbackQueue.size());
        }
    }

    int pendingCount() {
        return fallbackQueue.size();
    }

    private void send(OutboundNotification notification) throws Exception {
        try {
            kafkaTemplate.send(KafkaConfig.NOTIFICATIONS_TOPIC, notification.getPartitionKey(), notification)
                    .get(properties.getNotifications().getSendTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }
}
