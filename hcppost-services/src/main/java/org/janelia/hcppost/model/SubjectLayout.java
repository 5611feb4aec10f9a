package org.janelia.hcppost.model;

import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Locations of the inputs and outputs inside a subject's processed data folder.
 */
public class SubjectLayout {

    public static final List<String> ANALYSES_SUBDIRS = ImmutableList.of("FCmaps", "motion", "timecourses", "matlab_code", "workbench");

    private final Path subjectRoot;
    private final String subjectId;

    public SubjectLayout(Path subjectRoot, String subjectId) {
        this.subjectRoot = subjectRoot;
        this.subjectId = subjectId;
    }

    public Path getSubjectRoot() {
        return subjectRoot;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public Path getRawDataDir() {
        return subjectRoot.resolve("unprocessed").resolve("NIFTI");
    }

    public Path getSummaryDir() {
        return subjectRoot.resolve("summary");
    }

    public Path getAnalysesDir() {
        return subjectRoot.resolve("analyses_v2");
    }

    public Path getAnalysesSubdir(String name) {
        return getAnalysesDir().resolve(name);
    }

    public Path getMatlabCodeDir() {
        return getAnalysesSubdir("matlab_code");
    }

    public Path getMotionDir() {
        return getAnalysesSubdir("motion");
    }

    public Path getTimecoursesDir() {
        return getAnalysesSubdir("timecourses");
    }

    public Path getWorkbenchDir() {
        return getAnalysesSubdir("workbench");
    }

    public Path getResultsDir() {
        return subjectRoot.resolve("MNINonLinear").resolve("Results");
    }

    public Path getSeriesResultsDir(String seriesName) {
        return getResultsDir().resolve(seriesName);
    }

    public Path getRoisDir() {
        return subjectRoot.resolve("MNINonLinear").resolve("ROIs");
    }

    public Path getSegmentationVolume() {
        return getRoisDir().resolve("wmparc.2.nii.gz");
    }

    public Path getMergedDenseTimeSeries() {
        return getResultsDir().resolve(subjectId + "_FNL_preproc_Atlas.dtseries.nii");
    }

    public Path getSpecFile() {
        return subjectRoot.resolve("MNINonLinear").resolve("fsaverage_LR32k").resolve(subjectId + ".32k_fs_LR.wb.spec");
    }

    public Path getParcellatedTimeSeries(String atlasName, ParcellationVariant variant) {
        return getResultsDir().resolve(subjectId + "_FNL_preproc_" + atlasName + variant.getOutputSuffix() + ".ptseries.nii");
    }
}
