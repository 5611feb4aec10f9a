package org.janelia.hcppost.config;

/**
 * The configuration a subject run is processed with, resolved once at startup.
 */
public class PipelineConfiguration {
    private final String version;
    private final EnvironmentConfig environment;
    private final ProjectConfig project;

    public PipelineConfiguration(String version, EnvironmentConfig environment, ProjectConfig project) {
        this.version = version;
        this.environment = environment;
        this.project = project;
    }

    public String getVersion() {
        return version;
    }

    public EnvironmentConfig getEnvironment() {
        return environment;
    }

    public ProjectConfig getProject() {
        return project;
    }
}
