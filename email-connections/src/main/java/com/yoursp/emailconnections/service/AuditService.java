package com.yoursp.emailconnections.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.emailconnections.model.entity.AuditLog;
import com.yoursp.emailconnections.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Records audit trail entries for connection lifecycle events (connect, update,
 * delete, archive, error). A failed audit write is logged and never fails the
 * operation being audited.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    public static final String ENTITY_TYPE = "EmailConnection";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Record an audit log entry.
     *
     * @param userId   the user the action concerns (nullable for system actions)
     * @param action   short action descriptor, e.g. "CONNECTION_CREATED"
     * @param entityId the ID of the affected connection
     * @param metadata arbitrary key-value metadata (serialized as JSONB); never
     *                 token material
     */
    public void log(Long userId, String action, Long entityId, Map<String, Object> metadata) {
        AuditLog.AuditLogBuilder entry = AuditLog.builder()
                .userId(userId)
                .action(action)
                .entityType(ENTITY_TYPE)
                .entityId(entityId != null ? entityId.toString() : null);

        try {
            entry.metadata(metadata != null ? objectMapper.writeValueAsString(metadata) : null);
        } catch (JsonProcessingException e) {
            // Still save without metadata rather than losing the audit entry
            log.error("Failed to serialize audit metadata for action={}: {}", action, e.getMessage());
        }

        try {
            auditLogRepository.save(entry.build());
            log.debug("Audit logged: action={}, connection={}, user={}", action, entityId, userId);
        } catch (DataAccessException e) {
            log.error("Failed to write audit entry action={} connection={}: {}", action, entityId, e.getMessage());
        }
    }
}
