package org.janelia.hcppost.config;

import java.nio.file.Paths;

import com.google.common.collect.ImmutableMap;
import org.janelia.hcppost.cdi.ApplicationConfigProvider;
import org.janelia.hcppost.processing.exceptions.ConfigurationException;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;
import static org.mockito.Mockito.mock;

public class PipelineConfigurationResolverTest {

    private Logger logger;

    @Before
    public void setUp() {
        logger = mock(Logger.class);
    }

    private PipelineConfigurationResolver createResolver(ImmutableMap<String, String> overrides) {
        ApplicationConfig applicationConfig = new ApplicationConfigProvider()
                .fromResource("/hcppost.properties")
                .fromMap(overrides)
                .build();
        return new PipelineConfigurationResolver(applicationConfig, logger);
    }

    @Test
    public void aircEnvironment() {
        EnvironmentConfig environmentConfig = createResolver(ImmutableMap.of()).resolveEnvironment(Site.AIRC);
        assertThat(environmentConfig.getSite(), equalTo(Site.AIRC));
        assertThat(environmentConfig.getLabelDirectory(), equalTo(Paths.get("/group_shares/PSYCH/ROI_sets/Surface_schemes/Human")));
        assertThat(environmentConfig.getFslDirectory(), equalTo(Paths.get("/usr/share/fsl/5.0")));
        assertThat(environmentConfig.getWorkbenchCommand(),
                equalTo("/group_shares/PSYCH/code/external/utilities/workbench/bin_linux64/wb_command"));
        assertThat(environmentConfig.getHcpMatlabDirectory(), equalTo(Paths.get("/group_shares/PSYCH/code/development/utilities/HCP_Matlab")));
    }

    @Test
    public void rushmoreEnvironment() {
        EnvironmentConfig environmentConfig = createResolver(ImmutableMap.of()).resolveEnvironment(Site.RUSHMORE);
        assertThat(environmentConfig.getOctaveExecutable(), equalTo("/usr/bin/octave"));
        assertThat(environmentConfig.getWorkbenchCommand(), equalTo("/usr/bin/wb_command"));
        assertThat(environmentConfig.getRegressorCheckerScript(),
                equalTo(Paths.get("/mnt/max/shared/utilities/movmnt_regressor_check/movmnt_regressor_check.py")));
    }

    @Test
    public void humanStudyUsesDefaults() {
        ProjectConfig projectConfig = createResolver(ImmutableMap.of()).resolveProject(Study.ASD);
        assertThat(projectConfig.getBandPassOrder(), equalTo(2));
        assertThat(projectConfig.getLowPassHz(), closeTo(0.009, 1e-9));
        assertThat(projectConfig.getHighPassHz(), closeTo(0.08, 1e-9));
        assertThat(projectConfig.getFrameDisplacementThreshold(), closeTo(0.2, 1e-9));
        assertThat(projectConfig.getBrainRadiusInMm(), closeTo(50, 1e-9));
        assertThat(projectConfig.getMotionFilename(), equalTo("motion_numbers.txt"));
        assertThat(projectConfig.getWhiteMatterLeft(), equalTo(new ThresholdRange(3950, 4050)));
        assertThat(projectConfig.getWhiteMatterRight(), equalTo(new ThresholdRange(2950, 3050)));
        assertThat(projectConfig.getVentricleLeft(), equalTo(new ThresholdRange(4, 4)));
        assertThat(projectConfig.getVentricleRight(), equalTo(new ThresholdRange(43, 43)));
    }

    @Test
    public void primateStudiesUseSmallerBrainRadius() {
        PipelineConfigurationResolver resolver = createResolver(ImmutableMap.of());
        assertThat(resolver.resolveProject(Study.NHP_SAM).getBrainRadiusInMm(), closeTo(30, 1e-9));
        assertThat(resolver.resolveProject(Study.NHP_HFD).getBrainRadiusInMm(), closeTo(30, 1e-9));
        assertThat(resolver.resolveProject(Study.NHP_FEZCKO_CONFIG).getBrainRadiusInMm(), closeTo(30, 1e-9));
    }

    @Test
    public void fractionalBrainRadius() {
        ProjectConfig projectConfig = createResolver(ImmutableMap.of("Study.ASD.BrainRadiusInMm", "47.5")).resolveProject(Study.ASD);
        assertThat(projectConfig.getBrainRadiusInMm(), closeTo(47.5, 1e-9));
    }

    @Test
    public void studyValuesOverrideDefaults() {
        ProjectConfig projectConfig = createResolver(ImmutableMap.of("Study.ADHD.LowPassHz", "0.01")).resolveProject(Study.ADHD);
        assertThat(projectConfig.getLowPassHz(), closeTo(0.01, 1e-9));
        assertThat(projectConfig.getHighPassHz(), closeTo(0.08, 1e-9));
    }

    @Test
    public void resolveCompleteConfiguration() {
        PipelineConfiguration configuration = createResolver(ImmutableMap.of("Config.Version", "2.1")).resolve(Site.EXACLOUD, Study.ADHD);
        assertThat(configuration.getVersion(), equalTo("2.1"));
        assertThat(configuration.getEnvironment().getSite(), equalTo(Site.EXACLOUD));
        assertThat(configuration.getProject().getStudy(), equalTo(Study.ADHD));
    }

    @Test(expected = ConfigurationException.class)
    public void invalidThresholdRange() {
        createResolver(ImmutableMap.of("Study.ASD.VentricleLeft", "43,4")).resolveProject(Study.ASD);
    }

    @Test(expected = ConfigurationException.class)
    public void invalidNumber() {
        createResolver(ImmutableMap.of("Study.ASD.BandPassOrder", "second")).resolveProject(Study.ASD);
    }

    @Test(expected = ConfigurationException.class)
    public void missingSiteProperty() {
        new PipelineConfigurationResolver(new ApplicationConfigImpl(), logger).resolveEnvironment(Site.AIRC);
    }

    @Test(expected = ConfigurationException.class)
    public void unknownStudy() {
        Study.fromName("UNKNOWN_STUDY");
    }
}
