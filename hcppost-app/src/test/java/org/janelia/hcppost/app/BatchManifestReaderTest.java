package org.janelia.hcppost.app;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.janelia.hcppost.processing.exceptions.ConfigurationException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class BatchManifestReaderTest {

    @Rule
    public final TemporaryFolder testFolder = new TemporaryFolder();

    private final BatchManifestReader manifestReader = new BatchManifestReader();

    @Test
    public void readEntries() throws IOException {
        Path manifest = testFolder.newFile("subjects.csv").toPath();
        Files.write(manifest, ("# subjects scanned in 2016\n"
                + "sub01,/group_shares/PSYCH/ASD/sub01/visit/HCP_release/sub01\n"
                + "\n"
                + "  sub02 , /group_shares/PSYCH/ASD/sub02/visit/HCP_release/sub02  \n").getBytes());

        List<BatchEntry> entries = manifestReader.read(manifest);

        assertThat(entries, contains(
                new BatchEntry("sub01", "/group_shares/PSYCH/ASD/sub01/visit/HCP_release/sub01"),
                new BatchEntry("sub02", "/group_shares/PSYCH/ASD/sub02/visit/HCP_release/sub02")));
    }

    @Test(expected = ConfigurationException.class)
    public void invalidEntry() throws IOException {
        Path manifest = testFolder.newFile("subjects.csv").toPath();
        Files.write(manifest, "sub01\n".getBytes());
        manifestReader.read(manifest);
    }

    @Test(expected = ConfigurationException.class)
    public void missingManifest() {
        manifestReader.read(testFolder.getRoot().toPath().resolve("missing.csv"));
    }
}
