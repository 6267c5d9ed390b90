package com.ppm.backend.service.risk;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the project store as seen by risk analysis. Money is in the project currency,
 * durations in days, resource figures in hours.
 */
public interface ProjectDataPort {

    Optional<ProjectBaseline> findBaseline(Long projectId);

    List<RiskRecord> riskRecords(Long projectId);

    List<ResourceAllocation> resourceAllocations(Long projectId);

    List<MilestoneRecord> milestones(Long projectId);

    record ProjectBaseline(Long projectId,
                           String name,
                           double baselineBudget,
                           double currentSpend,
                           double contingencyReserve,
                           double baselineDurationDays,
                           double elapsedDays,
                           double scheduleBufferDays) {}

    /**
     * A risk register entry. Each dimension carries its own estimate in that dimension's unit;
     * a null estimate means the entry says nothing about that dimension.
     */
    record RiskRecord(String id,
                      String title,
                      String category,
                      String impactType,
                      String distributionType,
                      ImpactEstimate cost,
                      ImpactEstimate schedule,
                      ImpactEstimate resource) {}

    record ImpactEstimate(Double baseline,
                          Double low,
                          Double mostLikely,
                          Double high,
                          Double mean,
                          Double std) {

        public boolean isEmpty() {
            return baseline == null && low == null && mostLikely == null && high == null
                    && mean == null && std == null;
        }
    }

    record ResourceAllocation(String id, String name, double capacity, double allocated) {}

    record MilestoneRecord(String id,
                           String name,
                           LocalDate plannedDate,
                           double baselineDurationDays,
                           boolean criticalPath,
                           boolean completed) {}
}
