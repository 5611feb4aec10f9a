package org.janelia.hcppost.processing.tools;

import java.nio.file.Path;

import org.janelia.hcppost.config.EnvironmentConfig;
import org.janelia.hcppost.processing.common.ToolInvocation;

public class RegressorCheckCommands {

    private final EnvironmentConfig environmentConfig;

    public RegressorCheckCommands(EnvironmentConfig environmentConfig) {
        this.environmentConfig = environmentConfig;
    }

    public ToolInvocation check(Path rawSeries, Path regressorFile) {
        return new ToolInvocation.Builder("movmnt_regressor_check", environmentConfig.getPythonExecutable())
                .addArg(environmentConfig.getRegressorCheckerScript())
                .addArg("--fmri").addArg(rawSeries)
                .addArg("--movmnt").addArg(regressorFile)
                .build();
    }
}
