package com.autoflow.engine.persistence;

import com.autoflow.core.model.ApprovalRequest;
import com.autoflow.core.model.ApprovalStatus;
import com.autoflow.core.repository.ApprovalRequestRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * In-memory approval store. The pending index is derived from status, and
 * {@link #resolvePending} swaps atomically per key.
 */
public class InMemoryApprovalRequestRepository implements ApprovalRequestRepository {

    private final Map<UUID, ApprovalRequest> requests = new ConcurrentHashMap<>();

    @Override
    public void save(ApprovalRequest request) {
        if (requests.putIfAbsent(request.id(), request) != null) {
            throw new IllegalStateException("Approval request already exists: " + request.id());
        }
    }

    @Override
    public Optional<ApprovalRequest> findById(UUID approvalId) {
        return Optional.ofNullable(requests.get(approvalId));
    }

    @Override
    public Optional<ApprovalRequest> findPending(UUID approvalId) {
        return findById(approvalId).filter(ApprovalRequest::isPending);
    }

    @Override
    public boolean resolvePending(ApprovalRequest resolved) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        requests.computeIfPresent(resolved.id(), (id, current) -> {
            if (current.status() != ApprovalStatus.PENDING) {
                return current;
            }
            swapped.set(true);
            return resolved;
        });
        return swapped.get();
    }

    @Override
    public List<ApprovalRequest> findPendingByApprover(String approverId) {
        return requests.values().stream()
            .filter(ApprovalRequest::isPending)
            .filter(r -> r.approverId().equals(approverId))
            .sorted(Comparator.comparing(ApprovalRequest::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<ApprovalRequest> findByParticipant(String userId) {
        return requests.values().stream()
            .filter(r -> r.involves(userId))
            .sorted(Comparator.comparing(ApprovalRequest::createdAt).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public List<ApprovalRequest> findResolvedBetween(Instant after, Instant until, int limit) {
        return requests.values().stream()
            .filter(r -> !r.isPending() && r.respondedAt() != null)
            .filter(r -> r.respondedAt().isAfter(after) && !r.respondedAt().isAfter(until))
            .sorted(Comparator.comparing(ApprovalRequest::respondedAt))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long countPending() {
        return requests.values().stream().filter(ApprovalRequest::isPending).count();
    }
}
