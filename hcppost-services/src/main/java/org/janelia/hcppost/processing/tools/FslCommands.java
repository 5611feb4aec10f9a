package org.janelia.hcppost.processing.tools;

import java.nio.file.Path;

import org.janelia.hcppost.config.EnvironmentConfig;
import org.janelia.hcppost.config.ThresholdRange;
import org.janelia.hcppost.processing.common.ToolInvocation;

/**
 * FSL command lines. Every command runs with <code>FSLDIR</code> set and gzipped NIfTI output.
 */
public class FslCommands {

    private final Path fslDirectory;

    public FslCommands(EnvironmentConfig environmentConfig) {
        this.fslDirectory = environmentConfig.getFslDirectory();
    }

    public ToolInvocation threshold(Path input, ThresholdRange range, Path output) {
        return newInvocation("fslmaths")
                .addArg(input)
                .addArgs("-thr", String.valueOf(range.getLower()), "-uthr", String.valueOf(range.getUpper()))
                .addArg(output)
                .build();
    }

    public ToolInvocation addAndBinarize(Path input, Path toAdd, Path output) {
        return newInvocation("fslmaths")
                .addArg(input)
                .addArg("-add")
                .addArg(toAdd)
                .addArg("-bin")
                .addArg(output)
                .build();
    }

    public ToolInvocation erode(Path input, Path output) {
        return newInvocation("fslmaths")
                .addArg(input)
                .addArgs("-kernel", "gauss", "2", "-ero")
                .addArg(output)
                .build();
    }

    public ToolInvocation meanTimeSeries(Path input, Path output, Path mask) {
        return newInvocation("fslmeants")
                .addArg("-i").addArg(input)
                .addArg("-o").addArg(output)
                .addArg("-m").addArg(mask)
                .build();
    }

    public ToolInvocation header(Path input) {
        return newInvocation("fslhd")
                .addArg(input)
                .build();
    }

    private ToolInvocation.Builder newInvocation(String toolName) {
        return new ToolInvocation.Builder(toolName, fslDirectory.resolve("bin").resolve(toolName).toString())
                .env("FSLDIR", fslDirectory.toString())
                .env("FSLOUTPUTTYPE", "NIFTI_GZ");
    }
}
