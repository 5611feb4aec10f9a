package org.janelia.hcppost.processing.exceptions;

import org.janelia.hcppost.processing.common.ComputationException;

/**
 * A required input artifact (segmentation volume, dense time series, label directory...) is absent.
 */
public class MissingInputException extends ComputationException {

    public MissingInputException(String msg) {
        super(msg);
    }

    public MissingInputException(String msg, Throwable e) {
        super(msg, e);
    }

}
