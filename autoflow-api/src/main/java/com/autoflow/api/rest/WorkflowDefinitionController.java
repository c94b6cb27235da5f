package com.autoflow.api.rest;

import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.engine.service.WorkflowDefinitionService;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST API for workflow definitions and the built-in templates.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowDefinitionController {

    private final WorkflowDefinitionService definitionService;

    public WorkflowDefinitionController(WorkflowDefinitionService definitionService) {
        this.definitionService = definitionService;
    }

    /**
     * Register a definition from editor JSON. An existing id gets the next version.
     */
    @PostMapping
    public ResponseEntity<WorkflowDefinition> createDefinition(
            @RequestBody JsonNode editorJson,
            @RequestParam(name = "created_by", required = false) String createdBy) {
        WorkflowDefinition created = definitionService.create(editorJson, createdBy);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ResponseEntity<List<DefinitionSummary>> listDefinitions() {
        return ResponseEntity.ok(definitionService.listLatest().stream()
            .map(DefinitionSummary::from)
            .toList());
    }

    @GetMapping("/{workflowId}")
    public ResponseEntity<WorkflowDefinition> getDefinition(
            @PathVariable String workflowId,
            @RequestParam(required = false) Integer version) {
        WorkflowDefinition definition = version == null
            ? definitionService.getLatest(workflowId)
            : definitionService.getVersion(workflowId, version);
        return ResponseEntity.ok(definition);
    }

    @GetMapping("/templates")
    public ResponseEntity<List<DefinitionSummary>> listTemplates() {
        return ResponseEntity.ok(definitionService.templates().values().stream()
            .map(DefinitionSummary::from)
            .toList());
    }

    /**
     * Register a copy of a template under a fresh id.
     */
    @PostMapping("/templates/{templateName}")
    public ResponseEntity<WorkflowDefinition> instantiateTemplate(
            @PathVariable String templateName,
            @RequestParam(name = "created_by", required = false) String createdBy) {
        WorkflowDefinition created = definitionService.instantiateTemplate(templateName, createdBy);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    // ========== DTOs ==========

    public record DefinitionSummary(
        String id,
        int version,
        String name,
        String description,
        int stepCount,
        boolean enabled,
        Instant createdAt,
        String createdBy
    ) {
        public static DefinitionSummary from(WorkflowDefinition definition) {
            return new DefinitionSummary(
                definition.id(),
                definition.version(),
                definition.name(),
                definition.description(),
                definition.steps().size(),
                definition.enabled(),
                definition.createdAt(),
                definition.createdBy()
            );
        }
    }
}
