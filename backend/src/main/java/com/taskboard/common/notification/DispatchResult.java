package com.taskboard.common.notification;

/**
 * Outcome of handing a notification to the delivery pipeline.
 */
public enum DispatchResult {
    /** Accepted by the broker. */
    QUEUED,
    /** Broker unavailable; kept in the local fallback queue for retry. */
    PENDING
}
