package org.janelia.hcppost.model;

import java.nio.file.Path;

/**
 * Records an atlas variant that was skipped because its label file is absent.
 */
public class MissingAtlasWarning {
    private final String atlasName;
    private final ParcellationVariant variant;
    private final Path missingLabelFile;

    public MissingAtlasWarning(String atlasName, ParcellationVariant variant, Path missingLabelFile) {
        this.atlasName = atlasName;
        this.variant = variant;
        this.missingLabelFile = missingLabelFile;
    }

    public String getAtlasName() {
        return atlasName;
    }

    public ParcellationVariant getVariant() {
        return variant;
    }

    public Path getMissingLabelFile() {
        return missingLabelFile;
    }

    @Override
    public String toString() {
        return "No " + variant + " label file for atlas " + atlasName + ": " + missingLabelFile;
    }
}
