package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.hcppost.model.FinalOutputReport;
import org.janelia.hcppost.model.SubjectLayout;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;

public class FinalOutputsVerifierTest {

    @Rule
    public final TemporaryFolder testFolder = new TemporaryFolder();

    private FinalOutputsVerifier outputsVerifier;
    private SubjectLayout layout;

    @Before
    public void setUp() {
        outputsVerifier = new FinalOutputsVerifier(mock(Logger.class));
        layout = new SubjectLayout(testFolder.getRoot().toPath().resolve("sub01"), "sub01");
    }

    @Test
    public void allOutputsPresent() throws IOException {
        for (String output : FinalOutputsVerifier.EXPECTED_OUTPUTS) {
            Path outputPath = layout.getSubjectRoot().resolve(output);
            Files.createDirectories(outputPath.getParent());
            Files.createFile(outputPath);
        }
        FinalOutputReport report = outputsVerifier.verify(layout);
        assertTrue(report.isComplete());
        assertThat(report.getExpectedOutputs().size(), equalTo(10));
    }

    @Test
    public void missingOutputsAreReported() throws IOException {
        for (String output : FinalOutputsVerifier.EXPECTED_OUTPUTS) {
            if (output.endsWith("Yeo.csv")) {
                continue;
            }
            Path outputPath = layout.getSubjectRoot().resolve(output);
            Files.createDirectories(outputPath.getParent());
            Files.createFile(outputPath);
        }
        FinalOutputReport report = outputsVerifier.verify(layout);
        assertFalse(report.isComplete());
        assertThat(report.getMissingOutputs(), contains(layout.getTimecoursesDir().resolve("Yeo.csv")));
    }
}
