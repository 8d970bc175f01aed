package com.taskboard.task.event;

import com.taskboard.common.notification.NotificationDispatcher;
import com.taskboard.common.notification.NotificationKind;
import com.taskboard.common.notification.OutboundNotification;
import com.taskboard.user.domain.User;
import com.taskboard.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;
import java.util.Map;

/**
 * Notifies newly assigned users once the assignment has been committed.
 * Best-effort: failures are logged and never reach the request that made the assignment.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskAssignmentNotificationListener {

    private final UserRepository userRepository;
    private final NotificationDispatcher notificationDispatcher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTaskAssigned(TaskAssignedEvent event) {
        List<User> assignees = userRepository.findAllById(event.assigneeIds());
        for (User assignee : assignees) {
            if (assignee.getId().equals(event.assignedBy())) {
                continue;
            }
            try {
                OutboundNotification notification = OutboundNotification.builder()
                        .kind(NotificationKind.TASK_ASSIGNED)
                        .recipientEmail(assignee.getEmail())
                        .workspaceId(event.workspaceId())
                        .attributes(Map.of(
                                "taskId", String.valueOf(event.taskId()),
                                "taskTitle", event.taskTitle()))
                        .build();
                notificationDispatcher.dispatch(notification);
            } catch (RuntimeException e) {
                log.warn("Task assignment notification failed: task={}, assignee={}",
                        event.taskId(), assignee.getId(), e);
            }
        }
    }
}
