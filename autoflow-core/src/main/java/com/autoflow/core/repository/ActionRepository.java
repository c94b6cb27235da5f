package com.autoflow.core.repository;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionStatus;
import java.util.Optional;
import java.util.UUID;

/**
 * Store for compiled actions.
 */
public interface ActionRepository {

    void save(Action action);

    Optional<Action> findById(UUID actionId);

    /**
     * Update the status of an action. Status is the only mutable field.
     *
     * @return false if the action is unknown
     */
    boolean updateStatus(UUID actionId, ActionStatus status);
}
