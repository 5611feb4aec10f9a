package org.janelia.hcppost.app;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.beust.jcommander.JCommander;
import com.google.common.collect.ImmutableList;
import org.janelia.hcppost.model.FinalOutputReport;
import org.janelia.hcppost.processing.SubjectPostProcessor;
import org.janelia.hcppost.processing.exceptions.EngineTimeoutException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.Assert.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class PostProcessAppTest {

    @Rule
    public final TemporaryFolder testFolder = new TemporaryFolder();

    private SubjectPostProcessor subjectPostProcessor;
    private PostProcessApp app;

    @Before
    public void setUp() {
        subjectPostProcessor = mock(SubjectPostProcessor.class);
        app = new PostProcessApp(subjectPostProcessor, new BatchManifestReader());
    }

    private AppArgs parseArgs(String... args) {
        AppArgs appArgs = new AppArgs();
        JCommander.newBuilder().addObject(appArgs).build().parse(args);
        return appArgs;
    }

    @Test
    public void parseCommandLine() {
        AppArgs appArgs = parseArgs("--subject_ID", "sub01", "-o", "/data/sub01", "-p", "NHP_Sam",
                "-DEngine.Denoise.TimeoutInSeconds=300");
        assertThat(appArgs.subjectId, equalTo("sub01"));
        assertThat(appArgs.outputPath, equalTo("/data/sub01"));
        assertThat(appArgs.projectConfig, equalTo("NHP_Sam"));
        assertThat(appArgs.appDynamicConfig, hasEntry("Engine.Denoise.TimeoutInSeconds", "300"));
    }

    @Test
    public void singleSubjectSuccess() {
        when(subjectPostProcessor.process(anyString(), any(Path.class), any()))
                .thenReturn(new FinalOutputReport(ImmutableList.of(), ImmutableList.of()));

        assertThat(app.run(parseArgs("-s", "sub01", "-o", "/data/sub01", "-p", "ASD")), equalTo(PostProcessApp.SUCCESS));
        verify(subjectPostProcessor).process("sub01", Paths.get("/data/sub01"), "ASD");
    }

    @Test
    public void incompleteOutputsDoNotFailTheRun() {
        when(subjectPostProcessor.process(anyString(), any(Path.class), any()))
                .thenReturn(new FinalOutputReport(ImmutableList.of(Paths.get("/data/sub01/summary/FD_dist.png")),
                        ImmutableList.of(Paths.get("/data/sub01/summary/FD_dist.png"))));

        assertThat(app.run(parseArgs("-s", "sub01", "-o", "/data/sub01")), equalTo(PostProcessApp.SUCCESS));
    }

    @Test
    public void subjectFailure() {
        when(subjectPostProcessor.process(anyString(), any(Path.class), any()))
                .thenThrow(new EngineTimeoutException("analyses_v2 timed out", null));

        assertThat(app.run(parseArgs("-s", "sub01", "-o", "/data/sub01")), equalTo(PostProcessApp.FAILURE));
    }

    @Test
    public void batchContinuesAfterAFailedSubject() throws IOException {
        Path manifest = testFolder.newFile("subjects.csv").toPath();
        Files.write(manifest, "sub01,/data/sub01\nsub02,/data/sub02\n".getBytes());
        when(subjectPostProcessor.process(eq("sub01"), any(Path.class), any()))
                .thenThrow(new EngineTimeoutException("FNL_preproc_Matlab timed out", null));
        when(subjectPostProcessor.process(eq("sub02"), any(Path.class), any()))
                .thenReturn(new FinalOutputReport(ImmutableList.of(), ImmutableList.of()));

        assertThat(app.run(parseArgs("--list", manifest.toString())), equalTo(PostProcessApp.FAILURE));
        verify(subjectPostProcessor).process(eq("sub02"), eq(Paths.get("/data/sub02")), any());
    }

    @Test
    public void unexpectedErrorDoesNotStopTheBatch() throws IOException {
        Path manifest = testFolder.newFile("subjects.csv").toPath();
        Files.write(manifest, "sub01,/data/sub01\nsub02,/data/sub02\n".getBytes());
        when(subjectPostProcessor.process(eq("sub01"), any(Path.class), any()))
                .thenThrow(new IllegalStateException("REST3 cannot be merged after REST1"));
        when(subjectPostProcessor.process(eq("sub02"), any(Path.class), any()))
                .thenReturn(new FinalOutputReport(ImmutableList.of(), ImmutableList.of()));

        assertThat(app.run(parseArgs("--list", manifest.toString())), equalTo(PostProcessApp.FAILURE));
        verify(subjectPostProcessor).process(eq("sub02"), eq(Paths.get("/data/sub02")), any());
    }

    @Test
    public void missingSubjectArguments() {
        assertThat(app.run(parseArgs("-s", "sub01")), equalTo(PostProcessApp.FAILURE));
        verifyNoInteractions(subjectPostProcessor);
    }
}
