package org.janelia.hcppost.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The subject level dense time series built by concatenating the denoised series in ascending index order.
 */
public class MergedTimeSeries {
    private final Path path;
    private final List<Integer> mergedIndexes = new ArrayList<>();

    public MergedTimeSeries(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    public List<Integer> getMergedIndexes() {
        return Collections.unmodifiableList(mergedIndexes);
    }

    public boolean isEmpty() {
        return mergedIndexes.isEmpty();
    }

    public void checkCanAppend(int seriesIndex) {
        if (!mergedIndexes.isEmpty() && seriesIndex <= mergedIndexes.get(mergedIndexes.size() - 1)) {
            throw new IllegalStateException("Series " + seriesIndex + " cannot be merged after series " + mergedIndexes);
        }
    }

    public void append(int seriesIndex) {
        checkCanAppend(seriesIndex);
        mergedIndexes.add(seriesIndex);
    }
}
