package com.autoflow.engine.persistence.jdbc;

import com.autoflow.core.exception.DuplicateDefinitionException;
import com.autoflow.core.model.Connection;
import com.autoflow.core.model.Step;
import com.autoflow.core.model.Trigger;
import com.autoflow.core.model.WorkflowDefinition;
import com.autoflow.core.repository.WorkflowDefinitionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static com.autoflow.engine.persistence.jdbc.JdbcSupport.parseJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toInstant;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toTimestamp;

/**
 * PostgreSQL-backed definition store.
 * The graph (trigger, steps, connections) is kept in JSONB columns; rows are never updated.
 */
public class JdbcWorkflowDefinitionRepository implements WorkflowDefinitionRepository {

    private static final TypeReference<List<Step>> STEP_LIST = new TypeReference<>() { };
    private static final TypeReference<List<Connection>> CONNECTION_LIST = new TypeReference<>() { };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ObjectReader lenientReader;
    private final RowMapper<WorkflowDefinition> rowMapper = new WorkflowDefinitionRowMapper();

    public JdbcWorkflowDefinitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        // Derived accessors such as Connection.isGuarded() are written but not read back
        this.lenientReader = objectMapper.reader().without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    @Transactional
    public void save(WorkflowDefinition definition) {
        String sql = """
            INSERT INTO workflow_definitions (
                workflow_id, version, name, description,
                trigger_json, steps_json, connections_json, variables_json,
                enabled, created_at, created_by
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql,
                definition.id(),
                definition.version(),
                definition.name(),
                definition.description(),
                toJson(objectMapper, definition.trigger()),
                toJson(objectMapper, definition.steps()),
                toJson(objectMapper, definition.connections()),
                toJson(objectMapper, definition.variables()),
                definition.enabled(),
                toTimestamp(definition.createdAt()),
                definition.createdBy()
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateDefinitionException(definition.id(), definition.version());
        }
    }

    @Override
    public Optional<WorkflowDefinition> findLatest(String workflowId) {
        String sql = """
            SELECT * FROM workflow_definitions
            WHERE workflow_id = ?
            ORDER BY version DESC
            LIMIT 1
            """;
        return jdbcTemplate.query(sql, rowMapper, workflowId).stream().findFirst();
    }

    @Override
    public Optional<WorkflowDefinition> findVersion(String workflowId, int version) {
        String sql = "SELECT * FROM workflow_definitions WHERE workflow_id = ? AND version = ?";
        return jdbcTemplate.query(sql, rowMapper, workflowId, version).stream().findFirst();
    }

    @Override
    public List<WorkflowDefinition> findAllLatest() {
        String sql = """
            SELECT DISTINCT ON (workflow_id) * FROM workflow_definitions
            ORDER BY workflow_id, version DESC
            """;
        return jdbcTemplate.query(sql, rowMapper);
    }

    @Override
    public int latestVersion(String workflowId) {
        Integer version = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(version), 0) FROM workflow_definitions WHERE workflow_id = ?",
            Integer.class, workflowId);
        return version != null ? version : 0;
    }

    private class WorkflowDefinitionRowMapper implements RowMapper<WorkflowDefinition> {
        @Override
        public WorkflowDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new WorkflowDefinition(
                    rs.getString("workflow_id"),
                    rs.getInt("version"),
                    rs.getString("name"),
                    rs.getString("description"),
                    lenientReader.forType(Trigger.class).readValue(rs.getString("trigger_json")),
                    lenientReader.forType(STEP_LIST).readValue(rs.getString("steps_json")),
                    lenientReader.forType(CONNECTION_LIST).readValue(rs.getString("connections_json")),
                    parseJson(objectMapper, rs.getString("variables_json")),
                    rs.getBoolean("enabled"),
                    toInstant(rs.getTimestamp("created_at")),
                    rs.getString("created_by")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map workflow definition row", e);
            }
        }
    }
}
