package com.ppm.backend.repository;

import com.ppm.backend.model.ResourceAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResourceAssignmentRepository extends JpaRepository<ResourceAssignment, Long> {

    List<ResourceAssignment> findByProjectIdOrderByResourceNameAsc(Long projectId);
}
