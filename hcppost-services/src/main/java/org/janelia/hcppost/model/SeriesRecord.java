package org.janelia.hcppost.model;

import java.nio.file.Path;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * One resting state series of a subject and the state of its processing.
 */
public class SeriesRecord {
    private final Path rawPath;
    private final int index;
    private final Path resultsDir;
    private Double repetitionTime;
    private boolean regressorValid;
    private boolean excluded;
    private boolean denoised;
    private Path whiteMatterMeanFile;
    private Path ventricleMeanFile;

    public SeriesRecord(Path rawPath, int index, Path resultsDir) {
        if (index < 1) {
            throw new IllegalArgumentException("Series index must be positive: " + index);
        }
        this.rawPath = rawPath;
        this.index = index;
        this.resultsDir = resultsDir;
    }

    public Path getRawPath() {
        return rawPath;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return "REST" + index;
    }

    public Path getResultsDir() {
        return resultsDir;
    }

    public Path getWorkingDir() {
        return resultsDir.resolve("FNL_preproc");
    }

    public Path getRegressorFile() {
        return resultsDir.resolve("Movement_Regressors.txt");
    }

    public Path getFunctionalVolume() {
        return resultsDir.resolve(getName() + ".nii.gz");
    }

    public Path getDenseTimeSeries() {
        return resultsDir.resolve(getName() + "_Atlas.dtseries.nii");
    }

    public Path getWorkingDenseTimeSeries() {
        return getWorkingDir().resolve(getName() + "_Atlas.dtseries.nii");
    }

    public String getDenoisedTimeSeriesName() {
        return getName() + "_FNL_preproc_Atlas.dtseries.nii";
    }

    public Path getDenoisedTimeSeries() {
        return getWorkingDir().resolve(getDenoisedTimeSeriesName());
    }

    public Double getRepetitionTime() {
        return repetitionTime;
    }

    public void setRepetitionTime(Double repetitionTime) {
        this.repetitionTime = repetitionTime;
    }

    public boolean isRegressorValid() {
        return regressorValid;
    }

    public void setRegressorValid(boolean regressorValid) {
        this.regressorValid = regressorValid;
    }

    public boolean isExcluded() {
        return excluded;
    }

    public void setExcluded(boolean excluded) {
        this.excluded = excluded;
    }

    public boolean isDenoised() {
        return denoised;
    }

    public void setDenoised(boolean denoised) {
        this.denoised = denoised;
    }

    public Path getWhiteMatterMeanFile() {
        return whiteMatterMeanFile;
    }

    public void setWhiteMatterMeanFile(Path whiteMatterMeanFile) {
        this.whiteMatterMeanFile = whiteMatterMeanFile;
    }

    public Path getVentricleMeanFile() {
        return ventricleMeanFile;
    }

    public void setVentricleMeanFile(Path ventricleMeanFile) {
        this.ventricleMeanFile = ventricleMeanFile;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("name", getName())
                .append("rawPath", rawPath)
                .append("excluded", excluded)
                .toString();
    }
}
