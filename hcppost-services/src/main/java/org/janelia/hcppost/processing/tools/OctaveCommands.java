package org.janelia.hcppost.processing.tools;

import java.nio.file.Path;

import org.apache.commons.lang3.StringUtils;
import org.janelia.hcppost.config.EnvironmentConfig;
import org.janelia.hcppost.processing.common.ToolInvocation;

/**
 * Octave invocations of the numerical engine functions. Each function takes the path of its JSON configuration as
 * its single argument.
 */
public class OctaveCommands {

    private final EnvironmentConfig environmentConfig;

    public OctaveCommands(EnvironmentConfig environmentConfig) {
        this.environmentConfig = environmentConfig;
    }

    /**
     * The engine script directory and its <code>scripts</code> subdirectory are always on the Octave path; extra
     * library directories are added after them.
     */
    public ToolInvocation.Builder evalFunction(String functionName, Path configFile, Path... libraryDirectories) {
        Path scriptDirectory = environmentConfig.getEngineScriptDirectory();
        ToolInvocation.Builder invocationBuilder = new ToolInvocation.Builder("octave", environmentConfig.getOctaveExecutable())
                .addArgs("--traditional", "--quiet", "--no-gui")
                .addArg("--path").addArg(scriptDirectory)
                .addArg("--path").addArg(scriptDirectory.resolve("scripts"));
        for (Path libraryDirectory : libraryDirectories) {
            invocationBuilder.addArg("--path").addArg(libraryDirectory);
        }
        // octave string literal: single quotes around the path, embedded quotes doubled
        String quotedConfigFile = "'" + StringUtils.replace(configFile.toString(), "'", "''") + "'";
        return invocationBuilder.addArg("--eval").addArg(functionName + "(" + quotedConfigFile + ")");
    }
}
