package org.janelia.hcppost.processing.tools;

import java.nio.file.Path;

import org.janelia.hcppost.config.EnvironmentConfig;
import org.janelia.hcppost.processing.common.ToolInvocation;

/**
 * Connectome Workbench (<code>wb_command</code>) operations.
 */
public class WorkbenchCommands {

    private static final String TOOL_NAME = "wb_command";

    private final String workbenchCommand;

    public WorkbenchCommands(EnvironmentConfig environmentConfig) {
        this.workbenchCommand = environmentConfig.getWorkbenchCommand();
    }

    /**
     * Appends <code>toAppend</code> to <code>merged</code> in place.
     */
    public ToolInvocation ciftiMerge(Path merged, Path toAppend) {
        return new ToolInvocation.Builder(TOOL_NAME, workbenchCommand)
                .addArg("-cifti-merge")
                .addArg(merged)
                .addArg("-cifti").addArg(merged)
                .addArg("-cifti").addArg(toAppend)
                .build();
    }

    public ToolInvocation ciftiParcellate(Path denseTimeSeries, Path labelFile, Path output) {
        return new ToolInvocation.Builder(TOOL_NAME, workbenchCommand)
                .addArg("-cifti-parcellate")
                .addArg(denseTimeSeries)
                .addArg(labelFile)
                .addArg("COLUMN")
                .addArg(output)
                .build();
    }

    public ToolInvocation addToSpecFile(Path specFile, Path dataFile) {
        return new ToolInvocation.Builder(TOOL_NAME, workbenchCommand)
                .addArg("-add-to-spec-file")
                .addArg(specFile)
                .addArg("INVALID")
                .addArg(dataFile)
                .build();
    }
}
