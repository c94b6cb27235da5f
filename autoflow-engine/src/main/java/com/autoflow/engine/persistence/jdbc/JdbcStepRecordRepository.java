package com.autoflow.engine.persistence.jdbc;

import com.autoflow.core.model.StepRecord;
import com.autoflow.core.model.StepStatus;
import com.autoflow.core.model.StepType;
import com.autoflow.core.repository.StepRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import static com.autoflow.engine.persistence.jdbc.JdbcSupport.parseJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toInstant;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toTimestamp;

/**
 * PostgreSQL-backed step record store. Start order is kept by a serial column.
 */
public class JdbcStepRecordRepository implements StepRecordRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<StepRecord> rowMapper = new StepRecordRowMapper();

    public JdbcStepRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(StepRecord record) {
        String sql = """
            INSERT INTO step_records (
                record_id, execution_id, step_id, step_type, attempt, status,
                started_at, completed_at, result_json, error, error_code
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?)
            """;
        jdbcTemplate.update(sql,
            record.recordId(),
            record.executionId(),
            record.stepId(),
            record.stepType().name(),
            record.attempt(),
            record.status().name(),
            toTimestamp(record.startedAt()),
            toTimestamp(record.completedAt()),
            toJson(objectMapper, record.result()),
            record.error(),
            record.errorCode()
        );
    }

    @Override
    @Transactional
    public void update(StepRecord record) {
        String sql = """
            UPDATE step_records SET
                status = ?, completed_at = ?, result_json = ?::jsonb, error = ?, error_code = ?
            WHERE record_id = ?
            """;
        int rows = jdbcTemplate.update(sql,
            record.status().name(),
            toTimestamp(record.completedAt()),
            toJson(objectMapper, record.result()),
            record.error(),
            record.errorCode(),
            record.recordId()
        );
        if (rows == 0) {
            throw new IllegalStateException("Unknown step record " + record.recordId());
        }
    }

    @Override
    public List<StepRecord> findByExecution(UUID executionId) {
        String sql = "SELECT * FROM step_records WHERE execution_id = ? ORDER BY seq";
        return jdbcTemplate.query(sql, rowMapper, executionId);
    }

    @Override
    public List<StepRecord> findByExecutionAndAttempt(UUID executionId, int attempt) {
        String sql = "SELECT * FROM step_records WHERE execution_id = ? AND attempt = ? ORDER BY seq";
        return jdbcTemplate.query(sql, rowMapper, executionId, attempt);
    }

    @Override
    @Transactional
    public int deleteByExecutions(Collection<UUID> executionIds) {
        if (executionIds.isEmpty()) {
            return 0;
        }
        return new NamedParameterJdbcTemplate(jdbcTemplate).update(
            "DELETE FROM step_records WHERE execution_id IN (:ids)",
            new MapSqlParameterSource("ids", executionIds));
    }

    private class StepRecordRowMapper implements RowMapper<StepRecord> {
        @Override
        public StepRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new StepRecord(
                UUID.fromString(rs.getString("record_id")),
                UUID.fromString(rs.getString("execution_id")),
                rs.getString("step_id"),
                StepType.valueOf(rs.getString("step_type")),
                rs.getInt("attempt"),
                StepStatus.valueOf(rs.getString("status")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                parseJson(objectMapper, rs.getString("result_json")),
                rs.getString("error"),
                rs.getString("error_code")
            );
        }
    }
}
