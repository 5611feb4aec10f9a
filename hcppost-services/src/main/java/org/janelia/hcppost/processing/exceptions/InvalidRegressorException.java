package org.janelia.hcppost.processing.exceptions;

import org.janelia.hcppost.processing.common.ComputationException;

/**
 * The movement regressor checker rejected a series.
 */
public class InvalidRegressorException extends ComputationException {

    public InvalidRegressorException(String msg) {
        super(msg);
    }

    public InvalidRegressorException(String msg, Throwable e) {
        super(msg, e);
    }

}
