package org.janelia.hcppost.processing.common;

/**
 * Exception thrown by a processing step if something goes wrong during computation.
 */
public class ComputationException extends RuntimeException {

    public ComputationException(String message) {
        super(message);
    }

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ComputationException(Throwable cause) {
        super(cause);
    }

}
