package org.janelia.hcppost.processing.exceptions;

import org.janelia.hcppost.processing.common.ComputationException;

public class MissingRegressorException extends ComputationException {

    public MissingRegressorException(String msg) {
        super(msg);
    }

    public MissingRegressorException(String msg, Throwable e) {
        super(msg, e);
    }

}
