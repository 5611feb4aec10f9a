package org.janelia.hcppost.config;

import org.janelia.hcppost.processing.exceptions.ConfigurationException;

/**
 * Studies with their own filter and mask parameters.
 */
public enum Study {
    ASD("ASD"),
    ADHD("ADHD"),
    NHP_FEZCKO_CONFIG("NHP_Fezcko_config"),
    NHP_HFD("NHP_HFD"),
    NHP_SAM("NHP_Sam");

    private final String configName;

    Study(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static Study fromName(String name) {
        for (Study study : values()) {
            if (study.configName.equalsIgnoreCase(name) || study.name().equalsIgnoreCase(name)) {
                return study;
            }
        }
        throw new ConfigurationException("Unknown study: " + name);
    }

    @Override
    public String toString() {
        return configName;
    }
}
