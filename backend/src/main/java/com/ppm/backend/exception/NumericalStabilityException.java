package com.ppm.backend.exception;

public class NumericalStabilityException extends SimulationException {
    public NumericalStabilityException(String message) {
        super(message);
    }

    public NumericalStabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
