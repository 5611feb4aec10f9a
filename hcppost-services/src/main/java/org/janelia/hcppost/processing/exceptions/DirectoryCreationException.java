package org.janelia.hcppost.processing.exceptions;

import org.janelia.hcppost.processing.common.ComputationException;

public class DirectoryCreationException extends ComputationException {

    public DirectoryCreationException(String msg) {
        super(msg);
    }

    public DirectoryCreationException(String msg, Throwable e) {
        super(msg, e);
    }

}
