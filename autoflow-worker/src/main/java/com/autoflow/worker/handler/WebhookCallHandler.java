package com.autoflow.worker.handler;

import com.autoflow.core.exception.ErrorCodes;
import com.autoflow.worker.ConnectorException;
import com.autoflow.worker.StepContext;
import com.autoflow.worker.StepHandler;
import com.autoflow.worker.StepResult;
import com.autoflow.worker.connector.WebhookConnector;
import com.autoflow.worker.connector.WebhookConnector.WebhookResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Calls an HTTP endpoint. 4xx responses fail permanently, 5xx responses fail retryably.
 */
public class WebhookCallHandler implements StepHandler {

    static final Set<String> SUPPORTED_METHODS = Set.of("GET", "POST", "PUT", "DELETE");

    private final WebhookConnector connector;

    public WebhookCallHandler(WebhookConnector connector) {
        this.connector = connector;
    }

    @Override
    public StepResult handle(StepContext context) {
        String url = context.text("url").orElse(null);
        if (url == null) {
            return StepResult.invalidConfig("webhook_call requires 'url'");
        }
        String method = context.text("method").orElse("POST").toUpperCase(Locale.ROOT);
        if (!SUPPORTED_METHODS.contains(method)) {
            return StepResult.invalidConfig("Unsupported HTTP method: " + method);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        context.getConfig().path("headers").fields()
            .forEachRemaining(h -> headers.put(h.getKey(), h.getValue().asText()));
        headers.putIfAbsent("Idempotency-Key", context.getIdempotencyKey());

        JsonNode bodyNode = context.getConfig().path("body");
        String body = null;
        if (!bodyNode.isMissingNode() && !bodyNode.isNull() && !"GET".equals(method)) {
            body = bodyNode.isTextual() ? bodyNode.asText() : bodyNode.toString();
        }

        WebhookResponse response;
        try {
            response = connector.call(url, method, headers, body);
        } catch (ConnectorException e) {
            return StepResult.from(e);
        }

        if (!response.isSuccess()) {
            return StepResult.failure(ErrorCodes.CONNECTOR_ERROR,
                String.format("%s %s returned %d", method, url, response.statusCode()),
                response.isServerError());
        }

        ObjectNode output = context.newOutput();
        output.put("status_code", response.statusCode());
        output.set("response", parseBody(context, response.body()));
        return StepResult.ok(output);
    }

    private static JsonNode parseBody(StepContext context, String body) {
        if (body == null || body.isBlank()) {
            return context.getObjectMapper().nullNode();
        }
        try {
            return context.getObjectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            return context.getObjectMapper().getNodeFactory().textNode(body);
        }
    }
}
