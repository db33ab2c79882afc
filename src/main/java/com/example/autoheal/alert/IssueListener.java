package com.example.autoheal.alert;

import com.example.autoheal.domain.Issue;

/**
 * Callback for issue lifecycle events. Invoked outside the alert manager's lock;
 * an exception thrown by one listener never reaches the others.
 */
public interface IssueListener {

    void onIssueCreated(Issue issue);

    default void onIssueResolved(Issue issue) {
    }
}
