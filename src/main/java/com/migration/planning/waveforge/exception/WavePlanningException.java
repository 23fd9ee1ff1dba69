package com.migration.planning.waveforge.exception;

/**
 * Base type for structural failures raised while planning deployment waves.
 * All of them are deterministic properties of the input, so none is ever retried.
 */
public class WavePlanningException extends RuntimeException {

    public WavePlanningException(String message) {
        super(message);
    }

    public WavePlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
