package io.github.eutro.flowssa.core;

/**
 * Thrown when a graph cannot be built, analysed or converted.
 */
public class FlowSsaException extends RuntimeException {
    public FlowSsaException(String message) {
        super(message);
    }

    public FlowSsaException(String message, Throwable cause) {
        super(message, cause);
    }
}
