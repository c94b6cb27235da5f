package com.autoflow.api.rest;

import com.autoflow.core.model.Step;
import com.autoflow.core.model.StepType;
import com.autoflow.core.model.TriggerType;
import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.engine.test.EngineFixture;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Every controller over an in-memory engine, with the application's JSON conventions.
 */
class ApiFixture {

    final EngineFixture engine = new EngineFixture();
    final ObjectMapper mapper = new ObjectMapper()
        .findAndRegisterModules()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    final MockMvc mockMvc;

    ApiFixture() {
        mockMvc = MockMvcBuilders.standaloneSetup(
                new TriggerController(engine.intake),
                new ExecutionController(engine.coordinator),
                new WorkflowDefinitionController(engine.definitions),
                new ApprovalController(engine.approvalManager, engine.approvals))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(mapper))
            .build();
    }

    /**
     * One notification step saying "Hello {{name}}".
     */
    WorkflowDefinition registerGreeting(String id) {
        ObjectNode config = JsonNodeFactory.instance.objectNode();
        config.put("message", "Hello {{name}}");
        return engine.register(WorkflowDefinition.builder()
            .id(id)
            .name(id)
            .trigger("start", TriggerType.MANUAL)
            .step(Step.builder("greet", StepType.SEND_NOTIFICATION).config(config).build())
            .connect("start", "greet")
            .build());
    }

    String json(Object value) throws Exception {
        return mapper.writeValueAsString(value);
    }
}
