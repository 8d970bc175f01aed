package com.taskboard.common.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Logs notifications instead of emailing them. Real mail delivery is not part of this service.
 */
@Slf4j
@Service
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public void send(OutboundNotification notification) {
        log.info("[MAIL] {} (not sent):", notification.getKind());
        log.info("  To: {}", notification.getRecipientEmail());
        log.info("  Workspace: {}", notification.getWorkspaceId());
        notification.getAttributes().forEach((key, value) -> log.info("  {}: {}", key, value));
    }
}
