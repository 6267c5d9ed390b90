package com.ppm.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ppm.backend.model.AuditEvent;
import com.ppm.backend.repository.AuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Best-effort audit sink. A failed write is logged and never reaches the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditEventService {

    public static final String EVENT_TYPE_RISK_ANALYSIS = "RISK_ANALYSIS";

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;

    public void recordAnalysis(Long projectId, String action, String simulationId, String description, Object metadata) {
        try {
            String payload = metadata == null ? null : objectMapper.writeValueAsString(metadata);
            AuditEvent event = AuditEvent.builder()
                    .projectId(projectId)
                    .eventType(EVENT_TYPE_RISK_ANALYSIS)
                    .action(action)
                    .description(description)
                    .metadata(payload)
                    .simulationId(simulationId)
                    .createdAt(Instant.now())
                    .build();
            auditEventRepository.save(event);
        } catch (Exception e) {
            log.warn("Failed to record audit event {}:{} - {}", EVENT_TYPE_RISK_ANALYSIS, action, e.getMessage());
        }
    }
}
