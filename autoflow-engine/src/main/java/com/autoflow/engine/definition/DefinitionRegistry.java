package com.autoflow.engine.definition;

import com.autoflow.core.exception.NotFoundException;
import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.core.repository.WorkflowDefinitionRepository;
import com.autoflow.engine.service.WorkflowDefinitionService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Versioned definition registration on top of the definition store.
 * Definitions are validated before they are stored and never change afterwards.
 */
public class DefinitionRegistry implements WorkflowDefinitionService {

    private static final Logger log = LoggerFactory.getLogger(DefinitionRegistry.class);

    private final WorkflowDefinitionRepository definitionRepository;
    private final WorkflowDefinitionParser parser;
    private final WorkflowDefinitionValidator validator;
    private final Clock clock;

    public DefinitionRegistry(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowDefinitionParser parser,
            WorkflowDefinitionValidator validator,
            Clock clock) {
        this.definitionRepository = definitionRepository;
        this.parser = parser;
        this.validator = validator;
        this.clock = clock;
    }

    @Override
    public WorkflowDefinition register(WorkflowDefinition definition) {
        validator.validate(definition);

        int nextVersion = definitionRepository.latestVersion(definition.id()) + 1;
        WorkflowDefinition versioned = definition.withVersion(nextVersion);
        if (versioned.createdAt() == null) {
            versioned = WorkflowDefinition.builder()
                .id(versioned.id())
                .version(nextVersion)
                .name(versioned.name())
                .description(versioned.description())
                .trigger(versioned.trigger())
                .steps(versioned.steps())
                .connections(versioned.connections())
                .variables(versioned.variables())
                .enabled(versioned.enabled())
                .createdAt(clock.instant())
                .createdBy(versioned.createdBy())
                .build();
        }
        definitionRepository.save(versioned);

        log.info("Registered workflow {} ({} steps, {} connections)",
            versioned.versionKey(), versioned.steps().size(), versioned.connections().size());
        return versioned;
    }

    @Override
    public WorkflowDefinition create(JsonNode editorJson, String createdBy) {
        return register(parser.parse(editorJson, createdBy));
    }

    @Override
    public WorkflowDefinition getLatest(String workflowId) {
        return definitionRepository.findLatest(workflowId)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", workflowId));
    }

    @Override
    public WorkflowDefinition getVersion(String workflowId, int version) {
        return definitionRepository.findVersion(workflowId, version)
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", workflowId + ":" + version));
    }

    @Override
    public List<WorkflowDefinition> listLatest() {
        return definitionRepository.findAllLatest();
    }

    @Override
    public Map<String, WorkflowDefinition> templates() {
        return WorkflowTemplates.all();
    }

    @Override
    public WorkflowDefinition instantiateTemplate(String templateName, String createdBy) {
        WorkflowDefinition template = WorkflowTemplates.find(templateName)
            .orElseThrow(() -> new NotFoundException("WorkflowTemplate", templateName));
        String id = templateName + "-" + UUID.randomUUID().toString().substring(0, 8);
        return register(WorkflowDefinition.builder()
            .id(id)
            .name(template.name())
            .description(template.description())
            .trigger(template.trigger())
            .steps(template.steps())
            .connections(template.connections())
            .variables(template.variables())
            .enabled(true)
            .createdAt(clock.instant())
            .createdBy(createdBy)
            .build());
    }

    /**
     * Store every built-in template under its own name, unless a version already exists.
     *
     * @return number of templates registered
     */
    public int registerTemplates() {
        int registered = 0;
        for (WorkflowDefinition template : WorkflowTemplates.all().values()) {
            if (definitionRepository.latestVersion(template.id()) == 0) {
                register(template);
                registered++;
            }
        }
        log.info("Registered {} built-in workflow templates", registered);
        return registered;
    }
}
