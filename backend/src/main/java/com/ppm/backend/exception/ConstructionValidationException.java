package com.ppm.backend.exception;

/**
 * Raised when a distribution, correlation matrix, risk or mitigation is built from invalid input.
 */
public class ConstructionValidationException extends SimulationException {
    public ConstructionValidationException(String message) {
        super(message);
    }
}
