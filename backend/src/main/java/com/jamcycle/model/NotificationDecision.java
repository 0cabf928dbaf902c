package com.jamcycle.model;

/**
 * Operator answer collected by the notification channel.
 */
public enum NotificationDecision {
    APPROVE,
    DENY,
    TIMEOUT
}
