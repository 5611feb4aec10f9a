package org.janelia.hcppost.model;

/**
 * The two kinds of parcellated time series produced for every atlas.
 */
public enum ParcellationVariant {
    /** Surface and subcortical parcels. */
    COMBINED("_subcortical"),
    /** Subcortical parcels only. */
    SUBCORTICAL_ONLY("");

    private final String outputSuffix;

    ParcellationVariant(String outputSuffix) {
        this.outputSuffix = outputSuffix;
    }

    public String getOutputSuffix() {
        return outputSuffix;
    }
}
