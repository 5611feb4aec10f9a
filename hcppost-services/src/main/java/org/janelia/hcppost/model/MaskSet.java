package org.janelia.hcppost.model;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Eroded tissue masks used for the nuisance signals of every series.
 */
public class MaskSet {
    private final Path whiteMatterMask;
    private final Path ventricleMask;

    public MaskSet(Path whiteMatterMask, Path ventricleMask) {
        this.whiteMatterMask = whiteMatterMask;
        this.ventricleMask = ventricleMask;
    }

    public Path getWhiteMatterMask() {
        return whiteMatterMask;
    }

    public Path getVentricleMask() {
        return ventricleMask;
    }

    public Path getMask(TissueType tissueType) {
        return tissueType == TissueType.WHITE_MATTER ? whiteMatterMask : ventricleMask;
    }

    public boolean isComplete() {
        return Files.exists(whiteMatterMask) && Files.exists(ventricleMask);
    }
}
