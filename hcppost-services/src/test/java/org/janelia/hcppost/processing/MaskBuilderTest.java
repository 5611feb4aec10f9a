package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.hcppost.model.MaskSet;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.processing.common.ExternalToolRunner;
import org.janelia.hcppost.processing.common.ToolResult;
import org.janelia.hcppost.processing.exceptions.MissingInputException;
import org.janelia.hcppost.testhelpers.TestConfigurations;
import org.janelia.hcppost.testhelpers.ToolInvocationMatcher;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class MaskBuilderTest {

    @Rule
    public final TemporaryFolder testFolder = new TemporaryFolder();

    private ExternalToolRunner toolRunner;
    private MaskBuilder maskBuilder;
    private SubjectRun subjectRun;

    @Before
    public void setUp() {
        toolRunner = mock(ExternalToolRunner.class);
        maskBuilder = new MaskBuilder(toolRunner, mock(Logger.class));
        Path testDir = testFolder.getRoot().toPath();
        subjectRun = TestConfigurations.subjectRun(testDir.resolve("ASD"), "sub01", testDir.resolve("tools"));
    }

    private Path createSegmentation() throws IOException {
        Path segmentation = subjectRun.getLayout().getSegmentationVolume();
        Files.createDirectories(segmentation.getParent());
        return Files.createFile(segmentation);
    }

    @Test
    public void buildErodedMasks() throws IOException {
        Path segmentation = createSegmentation();
        Path roisDir = segmentation.getParent();
        when(toolRunner.run(any())).then(ToolRunnerAnswers.createLastArgument(0));

        MaskSet maskSet = maskBuilder.build(subjectRun);

        assertThat(maskSet.getWhiteMatterMask(), equalTo(roisDir.resolve("wm_2mm_sub01_mask_eroded.nii.gz")));
        assertThat(maskSet.getVentricleMask(), equalTo(roisDir.resolve("vent_2mm_sub01_mask_eroded.nii.gz")));
        assertTrue(maskSet.isComplete());
        verify(toolRunner, times(8)).run(any());
        verify(toolRunner).run(argThat(new ToolInvocationMatcher("fslmaths",
                segmentation, "-thr", "3950", "-uthr", "4050", roisDir.resolve("L_wm_2mm_sub01_mask.nii.gz"))));
        verify(toolRunner).run(argThat(new ToolInvocationMatcher("fslmaths",
                segmentation, "-thr", "43", "-uthr", "43", roisDir.resolve("R_vent_2mm_sub01_mask.nii.gz"))));
        verify(toolRunner).run(argThat(new ToolInvocationMatcher("fslmaths",
                roisDir.resolve("vent_2mm_sub01_mask.nii.gz"), "-kernel", "gauss", "2", "-ero",
                roisDir.resolve("vent_2mm_sub01_mask_eroded.nii.gz"))));
        assertFalse(Files.exists(roisDir.resolve("L_wm_2mm_sub01_mask.nii.gz")));
        assertFalse(Files.exists(roisDir.resolve("R_wm_2mm_sub01_mask.nii.gz")));
        assertFalse(Files.exists(roisDir.resolve("wm_2mm_sub01_mask.nii.gz")));
    }

    @Test
    public void rebuildingUsesTheSameOperations() throws IOException {
        Path segmentation = createSegmentation();
        when(toolRunner.run(any())).then(ToolRunnerAnswers.createLastArgument(0));

        MaskSet first = maskBuilder.build(subjectRun);
        MaskSet second = maskBuilder.build(subjectRun);

        assertThat(second.getWhiteMatterMask(), equalTo(first.getWhiteMatterMask()));
        assertThat(second.getVentricleMask(), equalTo(first.getVentricleMask()));
        verify(toolRunner, times(2)).run(argThat(new ToolInvocationMatcher("fslmaths",
                segmentation, "-thr", "2950", "-uthr", "3050", segmentation.getParent().resolve("R_wm_2mm_sub01_mask.nii.gz"))));
        assertFalse(Files.exists(segmentation.getParent().resolve("R_wm_2mm_sub01_mask.nii.gz")));
    }

    @Test
    public void missingSegmentation() {
        try {
            maskBuilder.build(subjectRun);
            fail("Expected the missing segmentation to be reported");
        } catch (MissingInputException e) {
            verify(toolRunner, never()).run(any());
        }
    }

    @Test
    public void failedThresholdStopsTheBuild() throws IOException {
        Path segmentation = createSegmentation();
        when(toolRunner.run(any()))
                .then(ToolRunnerAnswers.createLastArgument(0))
                .thenReturn(new ToolResult(1, "", "Image Exception"));
        try {
            maskBuilder.build(subjectRun);
            fail("Expected the failed threshold to be reported");
        } catch (ComputationException e) {
            verify(toolRunner, times(2)).run(any());
            assertFalse(Files.exists(segmentation.getParent().resolve("L_wm_2mm_sub01_mask.nii.gz")));
        }
    }
}
