package org.janelia.hcppost.processing.exceptions;

import org.janelia.hcppost.processing.common.ComputationException;

public class ExtractionException extends ComputationException {

    public ExtractionException(String msg) {
        super(msg);
    }

    public ExtractionException(String msg, Throwable e) {
        super(msg, e);
    }

}
