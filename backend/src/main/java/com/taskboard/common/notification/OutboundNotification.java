package com.taskboard.common.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka message for an outbound user notification (invitation email, assignment notice).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundNotification {

    private NotificationKind kind;

    private String recipientEmail;

    private Long workspaceId;

    /**
     * Template values, e.g. workspaceName, inviterName, inviteLink.
     */
    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();

    @Builder.Default
    private Instant createdAt = Instant.now();

    /**
     * Kafka partition key: one recipient's notifications stay ordered.
     */
    public String getPartitionKey() {
        return recipientEmail;
    }
}
