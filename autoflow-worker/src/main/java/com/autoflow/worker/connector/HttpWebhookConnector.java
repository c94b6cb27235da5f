package com.autoflow.worker.connector;

import com.autoflow.worker.ConnectorException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Webhook connector backed by the JDK HTTP client.
 */
public class HttpWebhookConnector implements WebhookConnector {

    private static final Logger log = LoggerFactory.getLogger(HttpWebhookConnector.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpWebhookConnector(Duration requestTimeout) {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build(), requestTimeout);
    }

    public HttpWebhookConnector(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public WebhookResponse call(String url, String method, Map<String, String> headers, String body)
            throws ConnectorException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw ConnectorException.permanent("Invalid webhook URL: " + url);
        }

        HttpRequest.BodyPublisher publisher = body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(requestTimeout)
            .method(method, publisher);
        headers.forEach(request::header);
        if (body != null && headers.keySet().stream().noneMatch("content-type"::equalsIgnoreCase)) {
            request.header("Content-Type", "application/json");
        }

        try {
            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            log.debug("Webhook {} {} returned {}", method, url, response.statusCode());
            return new WebhookResponse(response.statusCode(), response.body());
        } catch (IOException e) {
            throw new ConnectorException("Webhook call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectorException("Webhook call interrupted", e);
        }
    }
}
