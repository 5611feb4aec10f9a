package org.janelia.hcppost.model;

import java.util.List;

import com.google.common.collect.ImmutableList;

public class ParcellationResult {
    private final List<ParcellationArtifact> artifacts;
    private final List<MissingAtlasWarning> warnings;

    public ParcellationResult(List<ParcellationArtifact> artifacts, List<MissingAtlasWarning> warnings) {
        this.artifacts = ImmutableList.copyOf(artifacts);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public List<ParcellationArtifact> getArtifacts() {
        return artifacts;
    }

    public List<MissingAtlasWarning> getWarnings() {
        return warnings;
    }
}
