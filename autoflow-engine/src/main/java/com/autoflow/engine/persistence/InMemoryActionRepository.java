package com.autoflow.engine.persistence;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionStatus;
import com.autoflow.core.repository.ActionRepository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory action store.
 */
public class InMemoryActionRepository implements ActionRepository {

    private final Map<UUID, Action> actions = new ConcurrentHashMap<>();

    @Override
    public void save(Action action) {
        actions.put(action.id(), action);
    }

    @Override
    public Optional<Action> findById(UUID actionId) {
        return Optional.ofNullable(actions.get(actionId));
    }

    @Override
    public boolean updateStatus(UUID actionId, ActionStatus status) {
        return actions.computeIfPresent(actionId, (id, current) -> current.withStatus(status)) != null;
    }
}
