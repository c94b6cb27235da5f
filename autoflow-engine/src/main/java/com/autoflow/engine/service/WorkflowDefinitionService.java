package com.autoflow.engine.service;

import com.autoflow.core.model.WorkflowDefinition;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Registration and lookup of versioned workflow definitions.
 */
public interface WorkflowDefinitionService {

    /**
     * Validate and store a definition. An existing id gets the next version.
     *
     * @return the stored definition with its version assigned
     * @throws com.autoflow.core.exception.WorkflowValidationException if the graph is invalid
     */
    WorkflowDefinition register(WorkflowDefinition definition);

    /**
     * Parse editor JSON and register the result.
     */
    WorkflowDefinition create(JsonNode editorJson, String createdBy);

    /**
     * @throws com.autoflow.core.exception.NotFoundException if the id is unknown
     */
    WorkflowDefinition getLatest(String workflowId);

    /**
     * @throws com.autoflow.core.exception.NotFoundException if the version is unknown
     */
    WorkflowDefinition getVersion(String workflowId, int version);

    List<WorkflowDefinition> listLatest();

    Map<String, WorkflowDefinition> templates();

    /**
     * Register a copy of a built-in template under a fresh id.
     *
     * @throws com.autoflow.core.exception.NotFoundException if no template has that name
     */
    WorkflowDefinition instantiateTemplate(String templateName, String createdBy);
}
