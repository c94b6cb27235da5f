package com.autoflow.worker.connector;

import com.autoflow.worker.ConnectorException;
import java.util.Map;

/**
 * Generic outbound HTTP call.
 */
public interface WebhookConnector {

    /**
     * Perform a call. Non-2xx responses are returned, not thrown;
     * only transport failures raise {@link ConnectorException}.
     */
    WebhookResponse call(String url, String method, Map<String, String> headers, String body) throws ConnectorException;

    record WebhookResponse(int statusCode, String body) {

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }

        public boolean isServerError() {
            return statusCode >= 500;
        }
    }
}
