package org.janelia.hcppost.app;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

public class BatchEntry {
    private final String subjectId;
    private final String outputPath;

    public BatchEntry(String subjectId, String outputPath) {
        this.subjectId = subjectId;
        this.outputPath = outputPath;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getOutputPath() {
        return outputPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BatchEntry that = (BatchEntry) o;
        return new EqualsBuilder()
                .append(subjectId, that.subjectId)
                .append(outputPath, that.outputPath)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(subjectId)
                .append(outputPath)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("subjectId", subjectId)
                .append("outputPath", outputPath)
                .toString();
    }
}
