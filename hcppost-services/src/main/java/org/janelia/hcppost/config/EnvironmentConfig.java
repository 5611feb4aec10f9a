package org.janelia.hcppost.config;

import java.nio.file.Path;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Locations of the external tools and libraries at a given site.
 */
public class EnvironmentConfig {

    public static class Builder {
        private Site site;
        private Path labelDirectory;
        private Path regressorCheckerScript;
        private String pythonExecutable = "python";
        private Path fslDirectory;
        private String octaveExecutable;
        private String workbenchCommand;
        private Path framewiseDisplacementDirectory;
        private Path hcpMatlabDirectory;
        private Path engineScriptDirectory;

        public Builder site(Site site) {
            this.site = site;
            return this;
        }

        public Builder labelDirectory(Path labelDirectory) {
            this.labelDirectory = labelDirectory;
            return this;
        }

        public Builder regressorCheckerScript(Path regressorCheckerScript) {
            this.regressorCheckerScript = regressorCheckerScript;
            return this;
        }

        public Builder pythonExecutable(String pythonExecutable) {
            this.pythonExecutable = pythonExecutable;
            return this;
        }

        public Builder fslDirectory(Path fslDirectory) {
            this.fslDirectory = fslDirectory;
            return this;
        }

        public Builder octaveExecutable(String octaveExecutable) {
            this.octaveExecutable = octaveExecutable;
            return this;
        }

        public Builder workbenchCommand(String workbenchCommand) {
            this.workbenchCommand = workbenchCommand;
            return this;
        }

        public Builder framewiseDisplacementDirectory(Path framewiseDisplacementDirectory) {
            this.framewiseDisplacementDirectory = framewiseDisplacementDirectory;
            return this;
        }

        public Builder hcpMatlabDirectory(Path hcpMatlabDirectory) {
            this.hcpMatlabDirectory = hcpMatlabDirectory;
            return this;
        }

        public Builder engineScriptDirectory(Path engineScriptDirectory) {
            this.engineScriptDirectory = engineScriptDirectory;
            return this;
        }

        public EnvironmentConfig build() {
            return new EnvironmentConfig(this);
        }
    }

    private final Site site;
    private final Path labelDirectory;
    private final Path regressorCheckerScript;
    private final String pythonExecutable;
    private final Path fslDirectory;
    private final String octaveExecutable;
    private final String workbenchCommand;
    private final Path framewiseDisplacementDirectory;
    private final Path hcpMatlabDirectory;
    private final Path engineScriptDirectory;

    private EnvironmentConfig(Builder builder) {
        this.site = builder.site;
        this.labelDirectory = builder.labelDirectory;
        this.regressorCheckerScript = builder.regressorCheckerScript;
        this.pythonExecutable = builder.pythonExecutable;
        this.fslDirectory = builder.fslDirectory;
        this.octaveExecutable = builder.octaveExecutable;
        this.workbenchCommand = builder.workbenchCommand;
        this.framewiseDisplacementDirectory = builder.framewiseDisplacementDirectory;
        this.hcpMatlabDirectory = builder.hcpMatlabDirectory;
        this.engineScriptDirectory = builder.engineScriptDirectory;
    }

    public Site getSite() {
        return site;
    }

    public Path getLabelDirectory() {
        return labelDirectory;
    }

    public Path getRegressorCheckerScript() {
        return regressorCheckerScript;
    }

    public String getPythonExecutable() {
        return pythonExecutable;
    }

    public Path getFslDirectory() {
        return fslDirectory;
    }

    public String getOctaveExecutable() {
        return octaveExecutable;
    }

    public String getWorkbenchCommand() {
        return workbenchCommand;
    }

    public Path getFramewiseDisplacementDirectory() {
        return framewiseDisplacementDirectory;
    }

    public Path getHcpMatlabDirectory() {
        return hcpMatlabDirectory;
    }

    /**
     * @return directory holding FNL_preproc_Matlab.m, analyses_v2.m and their <code>scripts</code> subdirectory
     */
    public Path getEngineScriptDirectory() {
        return engineScriptDirectory;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("site", site)
                .append("labelDirectory", labelDirectory)
                .append("fslDirectory", fslDirectory)
                .append("octaveExecutable", octaveExecutable)
                .append("workbenchCommand", workbenchCommand)
                .toString();
    }
}
