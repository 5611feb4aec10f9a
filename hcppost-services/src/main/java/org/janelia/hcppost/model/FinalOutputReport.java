package org.janelia.hcppost.model;

import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;

public class FinalOutputReport {
    private final List<Path> expectedOutputs;
    private final List<Path> missingOutputs;

    public FinalOutputReport(List<Path> expectedOutputs, List<Path> missingOutputs) {
        this.expectedOutputs = ImmutableList.copyOf(expectedOutputs);
        this.missingOutputs = ImmutableList.copyOf(missingOutputs);
    }

    public List<Path> getExpectedOutputs() {
        return expectedOutputs;
    }

    public List<Path> getMissingOutputs() {
        return missingOutputs;
    }

    public boolean isComplete() {
        return missingOutputs.isEmpty();
    }
}
