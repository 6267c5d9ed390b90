package com.ppm.backend.repository;

import com.ppm.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

    List<AuditEvent> findByProjectIdOrderByCreatedAtDesc(Long projectId);
}
