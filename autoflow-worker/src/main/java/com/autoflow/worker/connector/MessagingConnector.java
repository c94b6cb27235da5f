package com.autoflow.worker.connector;

import com.autoflow.worker.ConnectorException;

/**
 * Outbound email-style messages.
 */
public interface MessagingConnector {

    /**
     * @return message id assigned by the mail system
     */
    String sendMessage(String to, String subject, String body) throws ConnectorException;
}
