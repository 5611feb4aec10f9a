package org.janelia.hcppost.config;

import java.nio.file.Paths;

import org.janelia.hcppost.processing.exceptions.ConfigurationException;
import org.junit.Test;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;

public class SiteResolverTest {

    private final SiteResolver siteResolver = new SiteResolver();

    @Test
    public void groupSharesAndScratchResolveToAirc() {
        assertThat(siteResolver.resolve(Paths.get("/group_shares/PSYCH/ASD/sub1/visit/HCP_release/sub1")), equalTo(Site.AIRC));
        assertThat(siteResolver.resolve(Paths.get("/scratch/sub1/HCP_release")), equalTo(Site.AIRC));
    }

    @Test
    public void exacloudPath() {
        assertThat(siteResolver.resolve(Paths.get("/home/exacloud/lustre1/ADHD/sub1/visit/HCP_release/sub1")), equalTo(Site.EXACLOUD));
    }

    @Test
    public void mountedStorageResolvesToRushmore() {
        assertThat(siteResolver.resolve(Paths.get("/mnt/max/shared/data/ASD/sub1/visit/HCP_release/sub1")), equalTo(Site.RUSHMORE));
    }

    @Test(expected = ConfigurationException.class)
    public void unknownLocation() {
        siteResolver.resolve(Paths.get("/home/user/data/ASD/sub1"));
    }

    @Test
    public void siteNamesAreCaseInsensitive() {
        assertThat(Site.fromName("AIRC"), equalTo(Site.AIRC));
        assertThat(Site.fromName("rushmore"), equalTo(Site.RUSHMORE));
    }
}
