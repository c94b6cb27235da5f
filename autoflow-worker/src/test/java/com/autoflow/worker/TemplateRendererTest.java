package com.autoflow.worker;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TemplateRenderer renderer = new TemplateRenderer();

    @Test
    void render_replacesPlaceholdersFromNestedPaths() throws Exception {
        JsonNode context = mapper.readTree("""
            {"subject": "Invoice", "lead": {"name": "Acme", "size": 250}, "create-task": {"task_id": "T-1"}}
            """);
        JsonNode config = mapper.readTree("""
            {"name": "Follow up with {{lead.name}}", "description": "Re: {{subject}} ({{create-task.task_id}})"}
            """);

        JsonNode rendered = renderer.render(config, context);

        assertThat(rendered.path("name").asText()).isEqualTo("Follow up with Acme");
        assertThat(rendered.path("description").asText()).isEqualTo("Re: Invoice (T-1)");
        assertThat(config.path("name").asText()).contains("{{lead.name}}");
    }

    @Test
    void render_wholePlaceholderKeepsType() throws Exception {
        JsonNode context = mapper.readTree("{\"lead\": {\"size\": 250, \"tags\": [\"a\", \"b\"]}}");
        JsonNode config = mapper.readTree("{\"size\": \"{{lead.size}}\", \"tags\": \"{{ lead.tags }}\"}");

        JsonNode rendered = renderer.render(config, context);

        assertThat(rendered.path("size").isInt()).isTrue();
        assertThat(rendered.path("tags").isArray()).isTrue();
    }

    @Test
    void render_missingValueRendersEmpty() throws Exception {
        JsonNode rendered = renderer.render(
            mapper.readTree("{\"to\": \"{{email.from}}\", \"body\": \"Hello {{name}}!\"}"),
            mapper.createObjectNode());

        assertThat(rendered.path("to").asText()).isEmpty();
        assertThat(rendered.path("body").asText()).isEqualTo("Hello !");
    }

    @Test
    void jsonPaths_resolveArrayIndexAndMissing() throws Exception {
        JsonNode root = mapper.readTree("{\"items\": [{\"id\": 3}], \"a.b\": 1}");

        assertThat(JsonPaths.resolve(root, "items.0.id").asInt()).isEqualTo(3);
        assertThat(JsonPaths.resolve(root, "a.b").asInt()).isEqualTo(1);
        assertThat(JsonPaths.resolve(root, "items.5.id").isMissingNode()).isTrue();
        assertThat(JsonPaths.resolve(root, "nope.x").isMissingNode()).isTrue();
    }
}
