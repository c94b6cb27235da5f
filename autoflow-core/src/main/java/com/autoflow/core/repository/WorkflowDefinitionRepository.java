package com.autoflow.core.repository;

import com.autoflow.core.model.WorkflowDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Repository for versioned workflow definitions.
 * Definitions are never updated in place; a new version is saved instead.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Save a definition version.
     *
     * @throws com.autoflow.core.exception.DuplicateDefinitionException if the version exists
     */
    void save(WorkflowDefinition definition);

    /**
     * Find the highest version of a definition.
     */
    Optional<WorkflowDefinition> findLatest(String workflowId);

    /**
     * Find a specific version of a definition.
     */
    Optional<WorkflowDefinition> findVersion(String workflowId, int version);

    /**
     * List the latest version of every definition, ordered by id.
     */
    List<WorkflowDefinition> findAllLatest();

    /**
     * Highest stored version, or 0 when the id is unknown.
     */
    int latestVersion(String workflowId);
}
