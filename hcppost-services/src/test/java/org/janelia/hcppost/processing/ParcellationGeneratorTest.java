package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

import org.janelia.hcppost.cdi.ApplicationConfigProvider;
import org.janelia.hcppost.config.ApplicationConfig;
import org.janelia.hcppost.model.MergedTimeSeries;
import org.janelia.hcppost.model.MissingAtlasWarning;
import org.janelia.hcppost.model.ParcellationArtifact;
import org.janelia.hcppost.model.ParcellationResult;
import org.janelia.hcppost.model.ParcellationVariant;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.processing.common.ExternalToolRunner;
import org.janelia.hcppost.processing.common.ToolInvocation;
import org.janelia.hcppost.processing.common.ToolResult;
import org.janelia.hcppost.processing.exceptions.MissingInputException;
import org.janelia.hcppost.testhelpers.TestConfigurations;
import org.janelia.hcppost.testhelpers.ToolInvocationMatcher;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ParcellationGeneratorTest {

    private static final String COMBINED_PATTERN = "{atlas}.subcortical.32k_fs_LR.dlabel.nii";
    private static final String SUBCORTICAL_ONLY_PATTERN = "{atlas}.subcortical_only.32k_fs_LR.dlabel.nii";

    @Rule
    public final TemporaryFolder testFolder = new TemporaryFolder();

    private ExternalToolRunner toolRunner;
    private ParcellationGenerator parcellationGenerator;
    private SubjectRun subjectRun;
    private Path labelDirectory;

    @Before
    public void setUp() {
        toolRunner = mock(ExternalToolRunner.class);
        parcellationGenerator = new ParcellationGenerator(toolRunner, COMBINED_PATTERN, SUBCORTICAL_ONLY_PATTERN, mock(Logger.class));
        Path testDir = testFolder.getRoot().toPath();
        subjectRun = TestConfigurations.subjectRun(testDir.resolve("ASD"), "sub01", testDir.resolve("tools"));
        labelDirectory = subjectRun.getConfiguration().getEnvironment().getLabelDirectory();
    }

    private Path createMergedSeries() throws IOException {
        Path merged = subjectRun.getLayout().getMergedDenseTimeSeries();
        Files.createDirectories(merged.getParent());
        Files.createFile(merged);
        MergedTimeSeries mergedTimeSeries = new MergedTimeSeries(merged);
        mergedTimeSeries.append(1);
        subjectRun.setMergedTimeSeries(mergedTimeSeries);
        return merged;
    }

    private Path createAtlas(String atlasName, ParcellationVariant... variants) throws IOException {
        Path atlasDir = Files.createDirectories(labelDirectory.resolve(atlasName).resolve("fsLR"));
        for (ParcellationVariant variant : variants) {
            Path labelFile = atlasDir.resolve(parcellationGenerator.getLabelFileName(atlasName, variant));
            if (Files.notExists(labelFile)) {
                Files.createFile(labelFile);
            }
        }
        return atlasDir;
    }

    @Test
    public void labelFileNames() {
        assertThat(parcellationGenerator.getLabelFileName("Gordon", ParcellationVariant.COMBINED),
                equalTo("Gordon.subcortical.32k_fs_LR.dlabel.nii"));
        assertThat(parcellationGenerator.getLabelFileName("Gordon", ParcellationVariant.SUBCORTICAL_ONLY),
                equalTo("Gordon.subcortical_only.32k_fs_LR.dlabel.nii"));
    }

    @Test
    public void parcellateEveryAvailableAtlasVariant() throws IOException {
        Path merged = createMergedSeries();
        Path gordonDir = createAtlas("Gordon", ParcellationVariant.COMBINED, ParcellationVariant.SUBCORTICAL_ONLY);
        createAtlas("Power", ParcellationVariant.COMBINED);
        createAtlas("Yeo");
        when(toolRunner.run(any())).thenReturn(new ToolResult(0, "", ""));

        ParcellationResult result = parcellationGenerator.generate(subjectRun);

        assertThat(result.getArtifacts().stream().map(ParcellationArtifact::getOutputFile).collect(Collectors.toList()), contains(
                subjectRun.getLayout().getParcellatedTimeSeries("Gordon", ParcellationVariant.COMBINED),
                subjectRun.getLayout().getParcellatedTimeSeries("Gordon", ParcellationVariant.SUBCORTICAL_ONLY),
                subjectRun.getLayout().getParcellatedTimeSeries("Power", ParcellationVariant.COMBINED)));
        assertThat(result.getArtifacts().get(0).getOutputFile().getFileName().toString(),
                equalTo("sub01_FNL_preproc_Gordon_subcortical.ptseries.nii"));
        assertThat(result.getWarnings().stream().map(MissingAtlasWarning::getAtlasName).collect(Collectors.toList()),
                contains("Power", "Yeo"));
        assertThat(subjectRun.getParcellations().size(), equalTo(3));

        Path specFile = subjectRun.getLayout().getSpecFile();
        verify(toolRunner).run(argThat(new ToolInvocationMatcher("wb_command", "-add-to-spec-file", specFile, "INVALID", merged)));
        verify(toolRunner).run(argThat(new ToolInvocationMatcher("wb_command",
                "-cifti-parcellate", merged, gordonDir.resolve("Gordon.subcortical.32k_fs_LR.dlabel.nii"), "COLUMN",
                subjectRun.getLayout().getParcellatedTimeSeries("Gordon", ParcellationVariant.COMBINED))));
        // one spec registration for the merged series plus parcellation and registration for each artifact
        verify(toolRunner, times(7)).run(any());
    }

    @Test
    public void defaultPatternsUseTheSubcorticalLabelsForBothVariants() throws IOException {
        ApplicationConfig applicationConfig = new ApplicationConfigProvider().fromResource("/hcppost.properties").build();
        parcellationGenerator = new ParcellationGenerator(toolRunner,
                applicationConfig.getStringPropertyValue("Parcellation.CombinedLabelPattern"),
                applicationConfig.getStringPropertyValue("Parcellation.SubcorticalOnlyLabelPattern"),
                mock(Logger.class));
        Path merged = createMergedSeries();
        Path gordonDir = Files.createDirectories(labelDirectory.resolve("Gordon").resolve("fsLR"));
        Path gordonLabels = Files.createFile(gordonDir.resolve("Gordon.subcortical.32k_fs_LR.dlabel.nii"));
        when(toolRunner.run(any())).thenReturn(new ToolResult(0, "", ""));

        ParcellationResult result = parcellationGenerator.generate(subjectRun);

        assertThat(result.getWarnings().size(), equalTo(0));
        assertThat(result.getArtifacts().stream().map(a -> a.getOutputFile().getFileName().toString()).collect(Collectors.toList()),
                contains("sub01_FNL_preproc_Gordon_subcortical.ptseries.nii", "sub01_FNL_preproc_Gordon.ptseries.nii"));
        verify(toolRunner).run(argThat(new ToolInvocationMatcher("wb_command",
                "-cifti-parcellate", merged, gordonLabels, "COLUMN",
                subjectRun.getLayout().getParcellatedTimeSeries("Gordon", ParcellationVariant.SUBCORTICAL_ONLY))));
    }

    @Test
    public void atlasWithoutCombinedLabelsIsSkipped() throws IOException {
        createMergedSeries();
        createAtlas("Yeo", ParcellationVariant.SUBCORTICAL_ONLY);
        when(toolRunner.run(any())).thenReturn(new ToolResult(0, "", ""));

        ParcellationResult result = parcellationGenerator.generate(subjectRun);

        assertThat(result.getArtifacts().size(), equalTo(0));
        assertThat(result.getWarnings().size(), equalTo(1));
        assertThat(result.getWarnings().get(0).getVariant(), equalTo(ParcellationVariant.COMBINED));
        verify(toolRunner, never()).run(argThat(new ToolInvocationMatcher("wb_command") {
            @Override
            public boolean matches(ToolInvocation argument) {
                return super.matches(argument) && argument.getArgs().contains("-cifti-parcellate");
            }
        }));
    }

    @Test(expected = MissingInputException.class)
    public void missingMergedSeries() {
        parcellationGenerator.generate(subjectRun);
    }

    @Test(expected = MissingInputException.class)
    public void missingLabelDirectory() throws IOException {
        createMergedSeries();
        when(toolRunner.run(any())).thenReturn(new ToolResult(0, "", ""));
        parcellationGenerator.generate(subjectRun);
    }

    @Test(expected = ComputationException.class)
    public void failedParcellation() throws IOException {
        createMergedSeries();
        createAtlas("Gordon", ParcellationVariant.COMBINED);
        when(toolRunner.run(any()))
                .thenReturn(new ToolResult(0, "", ""))
                .thenReturn(new ToolResult(1, "", "ERROR: label file does not match"));
        parcellationGenerator.generate(subjectRun);
    }
}
