package com.taskboard.common.notification;

/**
 * Delivers a notification to its recipient. Called by the Kafka consumer.
 */
public interface NotificationSender {

    void send(OutboundNotification notification);
}
