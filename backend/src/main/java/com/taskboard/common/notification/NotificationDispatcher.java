package com.taskboard.common.notification;

/**
 * Hands notifications to the asynchronous delivery pipeline.
 * Never throws for delivery problems; the result tells the caller whether the handoff succeeded.
 */
public interface NotificationDispatcher {

    DispatchResult dispatch(OutboundNotification notification);
}
