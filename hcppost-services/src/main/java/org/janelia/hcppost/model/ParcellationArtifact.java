package org.janelia.hcppost.model;

import java.nio.file.Path;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class ParcellationArtifact {
    private final String atlasName;
    private final ParcellationVariant variant;
    private final Path labelFile;
    private final Path outputFile;

    public ParcellationArtifact(String atlasName, ParcellationVariant variant, Path labelFile, Path outputFile) {
        this.atlasName = atlasName;
        this.variant = variant;
        this.labelFile = labelFile;
        this.outputFile = outputFile;
    }

    public String getAtlasName() {
        return atlasName;
    }

    public ParcellationVariant getVariant() {
        return variant;
    }

    public Path getLabelFile() {
        return labelFile;
    }

    public Path getOutputFile() {
        return outputFile;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("atlasName", atlasName)
                .append("variant", variant)
                .append("outputFile", outputFile)
                .toString();
    }
}
