package org.janelia.hcppost.config;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Inclusive label value range selected from the segmentation volume.
 */
public class ThresholdRange {
    private final int lower;
    private final int upper;

    public ThresholdRange(int lower, int upper) {
        if (lower > upper) {
            throw new IllegalArgumentException("Invalid threshold range " + lower + "-" + upper);
        }
        this.lower = lower;
        this.upper = upper;
    }

    public int getLower() {
        return lower;
    }

    public int getUpper() {
        return upper;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ThresholdRange that = (ThresholdRange) o;
        return new EqualsBuilder()
                .append(lower, that.lower)
                .append(upper, that.upper)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(lower)
                .append(upper)
                .toHashCode();
    }

    @Override
    public String toString() {
        return lower + "-" + upper;
    }
}
