package org.janelia.hcppost.processing.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.janelia.hcppost.config.EnvironmentConfig;
import org.janelia.hcppost.config.ProjectConfig;
import org.janelia.hcppost.model.SubjectLayout;

/**
 * Input of the subject level <code>analyses_v2</code> stage.
 */
@JsonPropertyOrder({
        "path_wb_c", "FNL_preproc_path", "framewise_disp_path", "epi_TR", "summary_Dir",
        "skip_seconds", "brain_radius_in_mm", "expected_contiguous_frame_count",
        "result_dir", "path_motion_numbers", "path_ciftis", "path_timecourses"
})
public class AnalysesEngineConfig {
    @JsonProperty("path_wb_c")
    private final String workbenchCommand;
    @JsonProperty("FNL_preproc_path")
    private final String engineScriptDirectory;
    @JsonProperty("framewise_disp_path")
    private final String framewiseDisplacementDirectory;
    @JsonProperty("epi_TR")
    private final double repetitionTime;
    @JsonProperty("summary_Dir")
    private final String summaryDir;
    @JsonProperty("skip_seconds")
    private final int skipSeconds;
    @JsonProperty("brain_radius_in_mm")
    private final double brainRadiusInMm;
    @JsonProperty("expected_contiguous_frame_count")
    private final int expectedContiguousFrameCount;
    @JsonProperty("result_dir")
    private final String resultDir;
    @JsonProperty("path_motion_numbers")
    private final String resultsDir;
    @JsonProperty("path_ciftis")
    private final String workbenchDir;
    @JsonProperty("path_timecourses")
    private final String timecoursesDir;

    public AnalysesEngineConfig(EnvironmentConfig environment, ProjectConfig project, SubjectLayout layout, double repetitionTime) {
        this.workbenchCommand = environment.getWorkbenchCommand();
        this.engineScriptDirectory = environment.getEngineScriptDirectory().toString();
        this.framewiseDisplacementDirectory = environment.getFramewiseDisplacementDirectory().toString();
        this.repetitionTime = repetitionTime;
        this.summaryDir = layout.getSummaryDir().toString();
        this.skipSeconds = project.getSkipSeconds();
        this.brainRadiusInMm = project.getBrainRadiusInMm();
        this.expectedContiguousFrameCount = project.getExpectedContiguousFrameCount();
        this.resultDir = layout.getMatlabCodeDir().toString();
        this.resultsDir = layout.getResultsDir().toString();
        this.workbenchDir = layout.getWorkbenchDir().toString();
        this.timecoursesDir = layout.getTimecoursesDir().toString();
    }
}
