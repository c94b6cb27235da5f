package com.autoflow.worker.connector;

import com.autoflow.worker.ConnectorException;

/**
 * Chat notifications to a channel or a single user.
 */
public interface NotificationConnector {

    /**
     * Send a notification.
     *
     * @param target        channel name (e.g. {@code #general}) or user id
     * @param directMessage true if target is a user
     * @param message       text to post
     * @return acknowledgement id from the chat system
     */
    String sendNotification(String target, boolean directMessage, String message) throws ConnectorException;
}
