package org.janelia.hcppost.processing;

import java.nio.file.Paths;

import org.janelia.hcppost.model.SubjectMetadata;
import org.janelia.hcppost.processing.exceptions.ConfigurationException;
import org.junit.Test;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;

public class PathSubjectMetadataResolverTest {

    private final PathSubjectMetadataResolver metadataResolver = new PathSubjectMetadataResolver();

    @Test
    public void resolveFromSubjectFolder() {
        SubjectMetadata metadata = metadataResolver.resolve(
                Paths.get("/group_shares/PSYCH/ASD/sub01/20160101-SIEMENS/HCP_release_20161027/sub01"), "sub01");
        assertThat(metadata.getProjectName(), equalTo("ASD"));
        assertThat(metadata.getVisitId(), equalTo("20160101-SIEMENS"));
        assertThat(metadata.getPipelineName(), equalTo("HCP_release_20161027"));
        assertThat(metadata.getStudyRoot(), equalTo(Paths.get("/group_shares/PSYCH/ASD")));
    }

    @Test
    public void resolveFromPipelineFolder() {
        SubjectMetadata metadata = metadataResolver.resolve(
                Paths.get("/mnt/max/shared/NHP_Sam/sub01/visit1/HCP_prerelease"), "sub01");
        assertThat(metadata.getProjectName(), equalTo("NHP_Sam"));
        assertThat(metadata.getVisitId(), equalTo("visit1"));
    }

    @Test(expected = ConfigurationException.class)
    public void notAnHcpPipeline() {
        metadataResolver.resolve(Paths.get("/group_shares/PSYCH/ASD/sub01/20160101-SIEMENS/FNL_release/sub01"), "sub01");
    }

    @Test(expected = ConfigurationException.class)
    public void pathTooShort() {
        metadataResolver.resolve(Paths.get("/visit/HCP_release/sub01"), "sub01");
    }
}
