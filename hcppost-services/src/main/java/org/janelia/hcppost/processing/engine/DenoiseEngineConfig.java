package org.janelia.hcppost.processing.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.janelia.hcppost.config.EnvironmentConfig;
import org.janelia.hcppost.config.ProjectConfig;
import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.model.SubjectLayout;

/**
 * Input of <code>FNL_preproc_Matlab</code> for one series.
 */
@JsonPropertyOrder({
        "path_wb_c", "FNL_preproc_path", "HCP_Mat_Path", "framewise_disp_path",
        "bp_order", "lp_Hz", "hp_Hz", "TR", "fd_th",
        "path_cii", "path_ex_sum", "FNL_preproc_CIFTI_name",
        "file_wm", "file_vent", "file_mov_reg", "motion_filename",
        "skip_seconds", "brain_radius_in_mm", "expected_contiguous_frame_count", "result_dir"
})
public class DenoiseEngineConfig {
    @JsonProperty("path_wb_c")
    private final String workbenchCommand;
    @JsonProperty("FNL_preproc_path")
    private final String engineScriptDirectory;
    @JsonProperty("HCP_Mat_Path")
    private final String hcpMatlabDirectory;
    @JsonProperty("framewise_disp_path")
    private final String framewiseDisplacementDirectory;
    @JsonProperty("bp_order")
    private final int bandPassOrder;
    @JsonProperty("lp_Hz")
    private final double lowPassHz;
    @JsonProperty("hp_Hz")
    private final double highPassHz;
    @JsonProperty("TR")
    private final double repetitionTime;
    @JsonProperty("fd_th")
    private final double frameDisplacementThreshold;
    @JsonProperty("path_cii")
    private final String denseTimeSeries;
    @JsonProperty("path_ex_sum")
    private final String summaryDir;
    @JsonProperty("FNL_preproc_CIFTI_name")
    private final String denoisedTimeSeriesName;
    @JsonProperty("file_wm")
    private final String whiteMatterMeanFile;
    @JsonProperty("file_vent")
    private final String ventricleMeanFile;
    @JsonProperty("file_mov_reg")
    private final String regressorFile;
    @JsonProperty("motion_filename")
    private final String motionFilename;
    @JsonProperty("skip_seconds")
    private final int skipSeconds;
    @JsonProperty("brain_radius_in_mm")
    private final double brainRadiusInMm;
    @JsonProperty("expected_contiguous_frame_count")
    private final int expectedContiguousFrameCount;
    @JsonProperty("result_dir")
    private final String resultDir;

    public DenoiseEngineConfig(EnvironmentConfig environment, ProjectConfig project, SubjectLayout layout, SeriesRecord series) {
        this.workbenchCommand = environment.getWorkbenchCommand();
        this.engineScriptDirectory = environment.getEngineScriptDirectory().toString();
        this.hcpMatlabDirectory = environment.getHcpMatlabDirectory().toString();
        this.framewiseDisplacementDirectory = environment.getFramewiseDisplacementDirectory().toString();
        this.bandPassOrder = project.getBandPassOrder();
        this.lowPassHz = project.getLowPassHz();
        this.highPassHz = project.getHighPassHz();
        this.repetitionTime = series.getRepetitionTime();
        this.frameDisplacementThreshold = project.getFrameDisplacementThreshold();
        this.denseTimeSeries = series.getDenseTimeSeries().toString();
        this.summaryDir = layout.getSummaryDir().toString();
        this.denoisedTimeSeriesName = series.getDenoisedTimeSeriesName();
        this.whiteMatterMeanFile = series.getWhiteMatterMeanFile().toString();
        this.ventricleMeanFile = series.getVentricleMeanFile().toString();
        this.regressorFile = series.getRegressorFile().toString();
        this.motionFilename = project.getMotionFilename();
        this.skipSeconds = project.getSkipSeconds();
        this.brainRadiusInMm = project.getBrainRadiusInMm();
        this.expectedContiguousFrameCount = project.getExpectedContiguousFrameCount();
        this.resultDir = series.getWorkingDir().toString();
    }
}
