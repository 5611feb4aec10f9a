package org.janelia.hcppost.processing.exceptions;

import org.janelia.hcppost.processing.common.ComputationException;

public class NoInputDataException extends ComputationException {

    public NoInputDataException(String msg) {
        super(msg);
    }

    public NoInputDataException(String msg, Throwable e) {
        super(msg, e);
    }

}
