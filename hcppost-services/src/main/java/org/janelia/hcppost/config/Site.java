package org.janelia.hcppost.config;

import org.janelia.hcppost.processing.exceptions.ConfigurationException;

/**
 * Compute sites where the pipeline runs. Each one has its own tool and library locations.
 */
public enum Site {
    AIRC("airc"),
    EXACLOUD("exacloud"),
    RUSHMORE("rushmore");

    private final String configName;

    Site(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static Site fromName(String name) {
        for (Site site : values()) {
            if (site.configName.equalsIgnoreCase(name) || site.name().equalsIgnoreCase(name)) {
                return site;
            }
        }
        throw new ConfigurationException("Unknown site: " + name);
    }

    @Override
    public String toString() {
        return configName;
    }
}
