package com.example.autoheal.notification;

import com.example.autoheal.domain.Issue;

/**
 * Outbound channel to humans. Both calls are fire-and-forget: a delivery
 * failure never rolls back the state change that triggered it.
 */
public interface NotificationChannel {

    void notify(String text);

    void requestApproval(Issue issue, String approvalId);
}
