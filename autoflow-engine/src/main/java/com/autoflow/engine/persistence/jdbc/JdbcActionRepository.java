package com.autoflow.engine.persistence.jdbc;

import com.autoflow.core.model.Action;
import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.ActionStatus;
import com.autoflow.core.repository.ActionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static com.autoflow.engine.persistence.jdbc.JdbcSupport.parseJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toInstant;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toTimestamp;

/**
 * PostgreSQL-backed action store.
 */
public class JdbcActionRepository implements ActionRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<Action> rowMapper = new ActionRowMapper();

    public JdbcActionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(Action action) {
        String sql = """
            INSERT INTO actions (
                action_id, kind, operation, priority, payload_json, requires_approval,
                confidence_threshold, max_retries, timeout_ms, status, created_at
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (action_id) DO UPDATE SET status = EXCLUDED.status
            """;
        jdbcTemplate.update(sql,
            action.id(),
            action.kind().name(),
            action.operation(),
            action.priority().name(),
            toJson(objectMapper, action.payload()),
            action.requiresApproval(),
            action.approvalConfidenceThreshold(),
            action.maxRetries(),
            action.timeout().toMillis(),
            action.status().name(),
            toTimestamp(action.createdAt())
        );
    }

    @Override
    public Optional<Action> findById(UUID actionId) {
        String sql = "SELECT * FROM actions WHERE action_id = ?";
        return jdbcTemplate.query(sql, rowMapper, actionId).stream().findFirst();
    }

    @Override
    @Transactional
    public boolean updateStatus(UUID actionId, ActionStatus status) {
        return jdbcTemplate.update("UPDATE actions SET status = ? WHERE action_id = ?",
            status.name(), actionId) > 0;
    }

    private class ActionRowMapper implements RowMapper<Action> {
        @Override
        public Action mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Action(
                UUID.fromString(rs.getString("action_id")),
                ActionKind.valueOf(rs.getString("kind")),
                rs.getString("operation"),
                ActionPriority.valueOf(rs.getString("priority")),
                parseJson(objectMapper, rs.getString("payload_json")),
                rs.getBoolean("requires_approval"),
                rs.getDouble("confidence_threshold"),
                rs.getInt("max_retries"),
                Duration.ofMillis(rs.getLong("timeout_ms")),
                toInstant(rs.getTimestamp("created_at")),
                ActionStatus.valueOf(rs.getString("status"))
            );
        }
    }
}
