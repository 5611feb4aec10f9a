package org.janelia.hcppost.processing.exceptions;

import org.janelia.hcppost.processing.common.ComputationException;

/**
 * Raised when the site or the study of a run cannot be resolved.
 */
public class ConfigurationException extends ComputationException {

    public ConfigurationException(String msg) {
        super(msg);
    }

    public ConfigurationException(String msg, Throwable e) {
        super(msg, e);
    }

}
