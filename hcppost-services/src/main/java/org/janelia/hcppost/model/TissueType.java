package org.janelia.hcppost.model;

public enum TissueType {
    WHITE_MATTER("wm"),
    VENTRICLE("vent");

    private final String label;

    TissueType(String label) {
        this.label = label;
    }

    /**
     * @return the short name used in mask and mean signal file names
     */
    public String getLabel() {
        return label;
    }
}
