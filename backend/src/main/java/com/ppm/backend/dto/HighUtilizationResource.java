package com.ppm.backend.dto;

public record HighUtilizationResource(String resourceId,
                                      String resourceName,
                                      double utilization,
                                      double capacity,
                                      double allocated) {
}
