package org.janelia.hcppost.config;

import java.nio.file.Path;

import org.janelia.hcppost.processing.exceptions.ConfigurationException;

/**
 * Infers the compute site from the location of the subject's processed data.
 */
public class SiteResolver {

    public Site resolve(Path outputPath) {
        String location = outputPath.toAbsolutePath().normalize().toString();
        if (location.contains("group_shares") || location.startsWith("/scratch/")) {
            return Site.AIRC;
        } else if (location.contains("exacloud")) {
            return Site.EXACLOUD;
        } else if (location.contains("/mnt/")) {
            return Site.RUSHMORE;
        } else {
            throw new ConfigurationException("No site is configured for " + location);
        }
    }
}
