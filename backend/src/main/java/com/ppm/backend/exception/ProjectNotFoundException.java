package com.ppm.backend.exception;

public class ProjectNotFoundException extends SimulationException {
    public ProjectNotFoundException(Long projectId) {
        super("Project not found: " + projectId);
    }
}
