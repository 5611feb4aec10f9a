package org.janelia.hcppost.processing.common;

import java.time.Duration;

/**
 * Exception thrown when an external tool does not complete within its time budget.
 */
public class ToolTimeoutException extends ComputationException {

    private final String toolName;
    private final Duration timeout;

    public ToolTimeoutException(String toolName, Duration timeout) {
        super(toolName + " timed out (elapsed time exceeded " + timeout.toMillis() + "ms)");
        this.toolName = toolName;
        this.timeout = timeout;
    }

    public String getToolName() {
        return toolName;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
