package com.autoflow.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{path}}} placeholders in step config against the execution context.
 * A string that is exactly one placeholder takes the referenced node as-is, keeping its type.
 * Unresolved placeholders render as empty text.
 */
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([\\w.\\-]+)\\s*}}");

    /**
     * Render a config tree. The input is not modified.
     */
    public JsonNode render(JsonNode config, JsonNode context) {
        if (config == null || config.isNull() || config.isMissingNode()) {
            return JsonNodeFactory.instance.objectNode();
        }
        return renderNode(config, context);
    }

    /**
     * Render a single string.
     */
    public String renderText(String template, JsonNode context) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            JsonNode value = JsonPaths.resolve(context, matcher.group(1));
            String replacement = value.isMissingNode() || value.isNull()
                ? ""
                : value.isValueNode() ? value.asText() : value.toString();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private JsonNode renderNode(JsonNode node, JsonNode context) {
        if (node.isTextual()) {
            String text = node.asText();
            Matcher whole = PLACEHOLDER.matcher(text);
            if (whole.matches()) {
                JsonNode value = JsonPaths.resolve(context, whole.group(1));
                return value.isMissingNode() ? TextNode.valueOf("") : value.deepCopy();
            }
            return text.contains("{{") ? TextNode.valueOf(renderText(text, context)) : node;
        }
        if (node.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), renderNode(field.getValue(), context));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> copy.add(renderNode(element, context)));
            return copy;
        }
        return node;
    }
}
