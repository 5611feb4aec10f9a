package org.janelia.hcppost.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import com.google.common.base.Splitter;
import jakarta.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.janelia.hcppost.cdi.qualifier.ApplicationProperties;
import org.janelia.hcppost.processing.exceptions.ConfigurationException;
import org.slf4j.Logger;

/**
 * Builds the {@link PipelineConfiguration} of a run from the <code>Site.&lt;site&gt;.*</code> and
 * <code>Study.&lt;study&gt;.*</code> application properties. A study property that is not set falls back to
 * the corresponding <code>Study.Defaults.*</code> entry.
 */
public class PipelineConfigurationResolver {

    private static final String STUDY_DEFAULTS = "Defaults";
    private static final Splitter BOUNDS_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final ApplicationConfig applicationConfig;
    private final Logger logger;

    @Inject
    public PipelineConfigurationResolver(@ApplicationProperties ApplicationConfig applicationConfig, Logger logger) {
        this.applicationConfig = applicationConfig;
        this.logger = logger;
    }

    public PipelineConfiguration resolve(Site site, Study study) {
        String version = applicationConfig.getStringPropertyValue("Config.Version", "unversioned");
        EnvironmentConfig environmentConfig = resolveEnvironment(site);
        ProjectConfig projectConfig = resolveProject(study);
        logger.info("Using configuration {} with {} and {}", version, environmentConfig, projectConfig);
        return new PipelineConfiguration(version, environmentConfig, projectConfig);
    }

    EnvironmentConfig resolveEnvironment(Site site) {
        String prefix = "Site." + site.getConfigName() + ".";
        return new EnvironmentConfig.Builder()
                .site(site)
                .labelDirectory(requiredPath(prefix + "LabelDirectory"))
                .regressorCheckerScript(requiredPath(prefix + "RegressorCheckerScript"))
                .pythonExecutable(applicationConfig.getStringPropertyValue(prefix + "Python", "python"))
                .fslDirectory(requiredPath(prefix + "FslDirectory"))
                .octaveExecutable(required(prefix + "Octave"))
                .workbenchCommand(required(prefix + "WorkbenchCommand"))
                .framewiseDisplacementDirectory(requiredPath(prefix + "FramewiseDisplacementDirectory"))
                .hcpMatlabDirectory(requiredPath(prefix + "HcpMatlabDirectory"))
                .engineScriptDirectory(requiredPath(prefix + "EngineScriptDirectory"))
                .build();
    }

    ProjectConfig resolveProject(Study study) {
        return new ProjectConfig.Builder()
                .study(study)
                .bandPassOrder(intStudyProperty(study, "BandPassOrder"))
                .lowPassHz(doubleStudyProperty(study, "LowPassHz"))
                .highPassHz(doubleStudyProperty(study, "HighPassHz"))
                .frameDisplacementThreshold(doubleStudyProperty(study, "FrameDisplacementThreshold"))
                .expectedContiguousFrameCount(intStudyProperty(study, "ExpectedContiguousFrameCount"))
                .skipSeconds(intStudyProperty(study, "SkipSeconds"))
                .brainRadiusInMm(doubleStudyProperty(study, "BrainRadiusInMm"))
                .motionFilename(studyProperty(study, "MotionFilename"))
                .whiteMatterLeft(thresholdRange(study, "WhiteMatterLeft"))
                .whiteMatterRight(thresholdRange(study, "WhiteMatterRight"))
                .ventricleLeft(thresholdRange(study, "VentricleLeft"))
                .ventricleRight(thresholdRange(study, "VentricleRight"))
                .build();
    }

    private String studyProperty(Study study, String name) {
        String value = applicationConfig.getStringPropertyValue("Study." + study.getConfigName() + "." + name);
        if (StringUtils.isBlank(value)) {
            value = applicationConfig.getStringPropertyValue("Study." + STUDY_DEFAULTS + "." + name);
        }
        if (StringUtils.isBlank(value)) {
            throw new ConfigurationException("No " + name + " configured for study " + study);
        }
        return value.trim();
    }

    private int intStudyProperty(Study study, String name) {
        String value = studyProperty(study, name);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + name + " value " + value + " for study " + study, e);
        }
    }

    private double doubleStudyProperty(Study study, String name) {
        String value = studyProperty(study, name);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + name + " value " + value + " for study " + study, e);
        }
    }

    private ThresholdRange thresholdRange(Study study, String name) {
        String value = studyProperty(study, name);
        List<String> bounds = BOUNDS_SPLITTER.splitToList(value);
        if (bounds.size() != 2) {
            throw new ConfigurationException("Invalid threshold range " + value + " for " + name + " in study " + study);
        }
        try {
            return new ThresholdRange(Integer.parseInt(bounds.get(0)), Integer.parseInt(bounds.get(1)));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid threshold range " + value + " for " + name + " in study " + study, e);
        }
    }

    private String required(String name) {
        String value = applicationConfig.getStringPropertyValue(name);
        if (StringUtils.isBlank(value)) {
            throw new ConfigurationException("Required property " + name + " is not set");
        }
        return value.trim();
    }

    private Path requiredPath(String name) {
        return Paths.get(required(name));
    }

}
