package com.autoflow.engine.persistence.jdbc;

import com.autoflow.core.model.ActionKind;
import com.autoflow.core.model.ActionPriority;
import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.core.repository.ApprovalRequestRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.autoflow.engine.persistence.jdbc.JdbcSupport.parseJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toInstant;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toJson;
import static com.autoflow.engine.persistence.jdbc.JdbcSupport.toTimestamp;

/**
 * PostgreSQL-backed approval store. The pending index is a partial index on status.
 */
public class JdbcApprovalRequestRepository implements ApprovalRequestRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<ApprovalRequest> rowMapper = new ApprovalRequestRowMapper();

    public JdbcApprovalRequestRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void save(ApprovalRequest request) {
        String sql = """
            INSERT INTO approval_requests (
                approval_id, action_id, action_kind, requester_id, approver_id,
                description, priority, payload_json, confidence_score, reasoning,
                status, created_at, responded_at, response_reason
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
            """;
        jdbcTemplate.update(sql,
            request.id(),
            request.actionId(),
            request.actionKind().name(),
            request.requesterId(),
            request.approverId(),
            request.description(),
            request.priority().name(),
            toJson(objectMapper, request.payload()),
            request.confidenceScore(),
            request.reasoning(),
            request.status().name(),
            toTimestamp(request.createdAt()),
            toTimestamp(request.respondedAt()),
            request.responseReason()
        );
    }

    @Override
    public Optional<ApprovalRequest> findById(UUID approvalId) {
        String sql = "SELECT * FROM approval_requests WHERE approval_id = ?";
        return jdbcTemplate.query(sql, rowMapper, approvalId).stream().findFirst();
    }

    @Override
    public Optional<ApprovalRequest> findPending(UUID approvalId) {
        String sql = "SELECT * FROM approval_requests WHERE approval_id = ? AND status = 'PENDING'";
        return jdbcTemplate.query(sql, rowMapper, approvalId).stream().findFirst();
    }

    @Override
    @Transactional
    public boolean resolvePending(ApprovalRequest resolved) {
        String sql = """
            UPDATE approval_requests SET
                status = ?, responded_at = ?, response_reason = ?
            WHERE approval_id = ? AND status = 'PENDING'
            """;
        return jdbcTemplate.update(sql,
            resolved.status().name(),
            toTimestamp(resolved.respondedAt()),
            resolved.responseReason(),
            resolved.id()
        ) > 0;
    }

    @Override
    public List<ApprovalRequest> findPendingByApprover(String approverId) {
        String sql = """
            SELECT * FROM approval_requests
            WHERE approver_id = ? AND status = 'PENDING'
            ORDER BY created_at
            """;
        return jdbcTemplate.query(sql, rowMapper, approverId);
    }

    @Override
    public List<ApprovalRequest> findByParticipant(String userId) {
        String sql = """
            SELECT * FROM approval_requests
            WHERE requester_id = ? OR approver_id = ?
            ORDER BY created_at DESC
            """;
        return jdbcTemplate.query(sql, rowMapper, userId, userId);
    }

    @Override
    public List<ApprovalRequest> findResolvedBetween(Instant after, Instant until, int limit) {
        String sql = """
            SELECT * FROM approval_requests
            WHERE status <> 'PENDING' AND responded_at > ? AND responded_at <= ?
            ORDER BY responded_at
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, rowMapper, toTimestamp(after), toTimestamp(until), limit);
    }

    @Override
    public long countPending() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM approval_requests WHERE status = 'PENDING'", Long.class);
        return count != null ? count : 0L;
    }

    private class ApprovalRequestRowMapper implements RowMapper<ApprovalRequest> {
        @Override
        public ApprovalRequest mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ApprovalRequest(
                UUID.fromString(rs.getString("approval_id")),
                UUID.fromString(rs.getString("action_id")),
                ActionKind.valueOf(rs.getString("action_kind")),
                rs.getString("requester_id"),
                rs.getString("approver_id"),
                rs.getString("description"),
                ActionPriority.valueOf(rs.getString("priority")),
                parseJson(objectMapper, rs.getString("payload_json")),
                rs.getDouble("confidence_score"),
                rs.getString("reasoning"),
                ApprovalStatus.valueOf(rs.getString("status")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("responded_at")),
                rs.getString("response_reason")
            );
        }
    }
}
