package org.janelia.hcppost.config;

/**
 * What to do with a series whose movement regressors are rejected.
 */
public enum RegressorFailurePolicy {
    /** Stop processing the subject. */
    ABORT_RUN,
    /** Leave the series out of denoising, merging and parcellation and go on with the others. */
    EXCLUDE_SERIES;

    public static RegressorFailurePolicy fromName(String name) {
        for (RegressorFailurePolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(name)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown regressor failure policy: " + name);
    }
}
