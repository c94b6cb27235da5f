package com.autoflow.engine.persistence.jdbc;

import com.autoflow.core.model.ExecutionStatus;
import com.autoflow.core.model.WorkflowExecution;
import com.autoflow.core.repository.WorkflowExecutionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.autoflow.engine.persistence.jdbc.JdbcSupport.parseJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toInstant;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toTimestamp;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toUuid;

/**
 * PostgreSQL-backed execution store.
 * Status changes are conditional updates on the expected status, so concurrent
 * writers (a finishing walk and a supervisor timing it out) cannot both win.
 */
public class JdbcWorkflowExecutionRepository implements WorkflowExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowExecutionRepository.class);

    private static final String TERMINAL_SQL = """
        (status IN ('COMPLETED', 'TIMEOUT', 'CANCELLED')
          OR (status = 'FAILED' AND retry_count >= max_retries))
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<WorkflowExecution> rowMapper = new WorkflowExecutionRowMapper();

    public JdbcWorkflowExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(WorkflowExecution execution) {
        String sql = """
            INSERT INTO workflow_executions (
                execution_id, workflow_id, workflow_version, status, checkpoint_step_id,
                trigger_payload_json, result_json, action_id, approval_id,
                error, error_code, retry_count, max_retries, next_attempt_at, running_timeout_ms,
                created_at, started_at, updated_at, completed_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            execution.executionId(),
            execution.workflowId(),
            execution.workflowVersion(),
            execution.status().name(),
            execution.checkpointStepId(),
            toJson(objectMapper, execution.triggerPayload()),
            toJson(objectMapper, execution.result()),
            execution.actionId(),
            execution.approvalId(),
            execution.error(),
            execution.errorCode(),
            execution.retryCount(),
            execution.maxRetries(),
            toTimestamp(execution.nextAttemptAt()),
            execution.runningTimeout() != null ? execution.runningTimeout().toMillis() : null,
            toTimestamp(execution.createdAt()),
            toTimestamp(execution.startedAt()),
            toTimestamp(execution.updatedAt()),
            toTimestamp(execution.completedAt())
        );
    }

    @Override
    public Optional<WorkflowExecution> findById(UUID executionId) {
        String sql = "SELECT * FROM workflow_executions WHERE execution_id = ?";
        return jdbcTemplate.query(sql, rowMapper, executionId).stream().findFirst();
    }

    @Override
    @Transactional
    public boolean compareAndSetStatus(UUID executionId, ExecutionStatus expected, WorkflowExecution updated) {
        String sql = """
            UPDATE workflow_executions SET
                status = ?,
                checkpoint_step_id = ?,
                trigger_payload_json = ?::jsonb,
                result_json = ?::jsonb,
                approval_id = ?,
                error = ?,
                error_code = ?,
                retry_count = ?,
                max_retries = ?,
                next_attempt_at = ?,
                started_at = ?,
                updated_at = ?,
                completed_at = ?
            WHERE execution_id = ? AND status = ?
            """;
        int rows = jdbcTemplate.update(sql,
            updated.status().name(),
            updated.checkpointStepId(),
            toJson(objectMapper, updated.triggerPayload()),
            toJson(objectMapper, updated.result()),
            updated.approvalId(),
            updated.error(),
            updated.errorCode(),
            updated.retryCount(),
            updated.maxRetries(),
            toTimestamp(updated.nextAttemptAt()),
            toTimestamp(updated.startedAt()),
            toTimestamp(updated.updatedAt()),
            toTimestamp(updated.completedAt()),
            executionId,
            expected.name()
        );
        if (rows == 0) {
            log.debug("Compare-and-set {} -> {} lost for execution {}", expected, updated.status(), executionId);
        }
        return rows > 0;
    }

    @Override
    public List<WorkflowExecution> findByStatus(ExecutionStatus status, int limit) {
        String sql = "SELECT * FROM workflow_executions WHERE status = ? ORDER BY created_at LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
    }

    @Override
    public List<WorkflowExecution> findRunningTimedOut(Instant now, Duration defaultTimeout, int limit) {
        String sql = """
            SELECT * FROM workflow_executions
            WHERE status = 'RUNNING'
              AND updated_at + COALESCE(running_timeout_ms, ?) * INTERVAL '1 millisecond' < ?
            ORDER BY updated_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, defaultTimeout.toMillis(), Timestamp.from(now), limit);
    }

    @Override
    public List<WorkflowExecution> findByStatusCreatedBefore(ExecutionStatus status, Instant cutoff, int limit) {
        String sql = """
            SELECT * FROM workflow_executions
            WHERE status = ? AND created_at < ?
            ORDER BY created_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, status.name(), Timestamp.from(cutoff), limit);
    }

    @Override
    public List<WorkflowExecution> findRetryingDueBefore(Instant cutoff, int limit) {
        String sql = """
            SELECT * FROM workflow_executions
            WHERE status = 'RETRYING' AND next_attempt_at < ?
            ORDER BY next_attempt_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(cutoff), limit);
    }

    @Override
    public List<WorkflowExecution> findRetryableFailed(int limit) {
        String sql = """
            SELECT * FROM workflow_executions
            WHERE status = 'FAILED' AND retry_count < max_retries
            ORDER BY updated_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, limit);
    }

    @Override
    public List<WorkflowExecution> findExhaustedUpdatedBetween(Instant after, Instant until, int limit) {
        String sql = """
            SELECT * FROM workflow_executions
            WHERE status = 'FAILED' AND retry_count >= max_retries
              AND updated_at > ? AND updated_at <= ?
            ORDER BY updated_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(after), Timestamp.from(until), limit);
    }

    @Override
    public Optional<WorkflowExecution> findByApprovalId(UUID approvalId) {
        String sql = "SELECT * FROM workflow_executions WHERE approval_id = ? LIMIT 1";
        return jdbcTemplate.query(sql, rowMapper, approvalId).stream().findFirst();
    }

    @Override
    public List<WorkflowExecution> findByWorkflowId(String workflowId, int limit) {
        String sql = "SELECT * FROM workflow_executions WHERE workflow_id = ? ORDER BY created_at DESC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, workflowId, limit);
    }

    @Override
    public Map<ExecutionStatus, Long> countByStatus() {
        Map<ExecutionStatus, Long> counts = new EnumMap<>(ExecutionStatus.class);
        jdbcTemplate.query("SELECT status, COUNT(*) AS count FROM workflow_executions GROUP BY status", rs -> {
            counts.put(ExecutionStatus.valueOf(rs.getString("status")), rs.getLong("count"));
        });
        return counts;
    }

    @Override
    @Transactional
    public List<UUID> deleteTerminalBefore(Instant completedBefore) {
        String sql = "DELETE FROM workflow_executions WHERE " + TERMINAL_SQL
            + " AND completed_at < ? RETURNING execution_id";
        return jdbcTemplate.query(sql,
            (rs, rowNum) -> UUID.fromString(rs.getString("execution_id")),
            Timestamp.from(completedBefore));
    }

    private static Duration toDuration(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Duration.ofMillis(millis);
    }

    private class WorkflowExecutionRowMapper implements RowMapper<WorkflowExecution> {
        @Override
        public WorkflowExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new WorkflowExecution(
                UUID.fromString(rs.getString("execution_id")),
                rs.getString("workflow_id"),
                rs.getInt("workflow_version"),
                ExecutionStatus.valueOf(rs.getString("status")),
                rs.getString("checkpoint_step_id"),
                parseJson(objectMapper, rs.getString("trigger_payload_json")),
                parseJson(objectMapper, rs.getString("result_json")),
                toUuid(rs.getString("action_id")),
                toUuid(rs.getString("approval_id")),
                rs.getString("error"),
                rs.getString("error_code"),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                toInstant(rs.getTimestamp("next_attempt_at")),
                toDuration(rs, "running_timeout_ms"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("updated_at")),
                toInstant(rs.getTimestamp("completed_at"))
            );
        }
    }
}
