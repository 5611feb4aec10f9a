package org.janelia.hcppost.processing.exceptions;

import org.janelia.hcppost.processing.common.ComputationException;

/**
 * The numerical engine exceeded its time budget on every attempt and left no usable output behind.
 */
public class EngineTimeoutException extends ComputationException {

    public EngineTimeoutException(String msg, Throwable e) {
        super(msg, e);
    }

}
