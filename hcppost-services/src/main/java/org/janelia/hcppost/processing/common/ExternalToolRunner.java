package org.janelia.hcppost.processing.common;

/**
 * Runs external command line tools (FSL, Workbench, Octave...) and blocks until they complete.
 */
public interface ExternalToolRunner {
    /**
     * @throws ToolTimeoutException if the invocation has a timeout and the tool does not finish within it
     * @throws ComputationException if the tool could not be started
     */
    ToolResult run(ToolInvocation invocation);
}
