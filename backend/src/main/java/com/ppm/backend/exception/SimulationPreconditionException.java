package com.ppm.backend.exception;

/**
 * Caller error detected before any sampling starts. Never retried.
 */
public class SimulationPreconditionException extends SimulationException {
    public SimulationPreconditionException(String message) {
        super(message);
    }
}
