package com.autoflow.engine.approval;

import com.autoflow.core.model.ApprovalRequest;

/**
 * Outbound side of the approval channel: tells an approver a decision is waiting.
 * Decisions come back through {@link ApprovalManager#approve} and {@link ApprovalManager#reject}.
 */
public interface ApprovalChannel {

    /**
     * Publish a pending request.
     *
     * @throws ApprovalChannelException if the message could not be delivered
     */
    void publish(ApprovalRequest request);

    /**
     * Raised when the channel cannot deliver a request.
     */
    class ApprovalChannelException extends RuntimeException {
        public ApprovalChannelException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
