package com.autoflow.engine.persistence;

import com.autoflow.core.exception.DuplicateDefinitionException;
import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.core.repository.WorkflowDefinitionRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ConcurrentNavigableMap;

/**
 * In-memory definition store: workflow id to versions, highest version last.
 */
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private final Map<String, ConcurrentNavigableMap<Integer, WorkflowDefinition>> definitions =
        new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowDefinition definition) {
        ConcurrentNavigableMap<Integer, WorkflowDefinition> versions =
            definitions.computeIfAbsent(definition.id(), k -> new ConcurrentSkipListMap<>());
        if (versions.putIfAbsent(definition.version(), definition) != null) {
            throw new DuplicateDefinitionException(definition.id(), definition.version());
        }
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String workflowId) {
        ConcurrentNavigableMap<Integer, WorkflowDefinition> versions = definitions.get(workflowId);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.lastEntry().getValue());
    }

    @Override
    public Optional<WorkflowDefinition> findVersion(String workflowId, int version) {
        ConcurrentNavigableMap<Integer, WorkflowDefinition> versions = definitions.get(workflowId);
        return versions == null ? Optional.empty() : Optional.ofNullable(versions.get(version));
    }

    @Override
    public List<WorkflowDefinition> findAllLatest() {
        return definitions.values().stream()
            .filter(v -> !v.isEmpty())
            .map(v -> v.lastEntry().getValue())
            .sorted(Comparator.comparing(WorkflowDefinition::id))
            .toList();
    }

    @Override
    public int latestVersion(String workflowId) {
        ConcurrentNavigableMap<Integer, WorkflowDefinition> versions = definitions.get(workflowId);
        return versions == null || versions.isEmpty() ? 0 : versions.lastKey();
    }
}
