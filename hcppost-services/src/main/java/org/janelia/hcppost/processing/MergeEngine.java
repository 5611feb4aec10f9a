package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import jakarta.inject.Inject;

import org.janelia.hcppost.model.MergedTimeSeries;
import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.processing.common.ExternalToolRunner;
import org.janelia.hcppost.processing.common.ToolInvocation;
import org.janelia.hcppost.processing.common.ToolResult;
import org.janelia.hcppost.processing.exceptions.MissingInputException;
import org.janelia.hcppost.processing.tools.WorkbenchCommands;
import org.slf4j.Logger;

/**
 * Concatenates the denoised series of a subject into one dense time series. The first merged series is copied,
 * every following one is appended with <code>wb_command -cifti-merge</code>.
 */
public class MergeEngine {

    private final ExternalToolRunner toolRunner;
    private final Logger logger;

    @Inject
    public MergeEngine(ExternalToolRunner toolRunner, Logger logger) {
        this.toolRunner = toolRunner;
        this.logger = logger;
    }

    public MergedTimeSeries merge(SubjectRun subjectRun, SeriesRecord series) {
        Path denoisedSeries = series.getDenoisedTimeSeries();
        if (Files.notExists(denoisedSeries)) {
            throw new MissingInputException("Denoised time series " + denoisedSeries + " not found");
        }
        MergedTimeSeries mergedTimeSeries = subjectRun.getMergedTimeSeries();
        if (mergedTimeSeries == null || mergedTimeSeries.isEmpty()) {
            mergedTimeSeries = startMerge(subjectRun.getLayout().getMergedDenseTimeSeries(), series);
            subjectRun.setMergedTimeSeries(mergedTimeSeries);
        } else {
            mergedTimeSeries.checkCanAppend(series.getIndex());
            ToolInvocation mergeInvocation = new WorkbenchCommands(subjectRun.getConfiguration().getEnvironment())
                    .ciftiMerge(mergedTimeSeries.getPath(), denoisedSeries);
            ToolResult result = toolRunner.run(mergeInvocation);
            if (!result.isSuccessful()) {
                throw new ComputationException("Merging " + denoisedSeries + " into " + mergedTimeSeries.getPath()
                        + " failed with exit code " + result.getExitCode());
            }
            mergedTimeSeries.append(series.getIndex());
            logger.info("Appended {} to {}", series.getName(), mergedTimeSeries.getPath());
        }
        return mergedTimeSeries;
    }

    private MergedTimeSeries startMerge(Path mergedPath, SeriesRecord series) {
        MergedTimeSeries mergedTimeSeries = new MergedTimeSeries(mergedPath);
        try {
            Files.deleteIfExists(mergedPath);
            Files.copy(series.getDenoisedTimeSeries(), mergedPath);
        } catch (IOException e) {
            throw new ComputationException("Error starting merged time series " + mergedPath + " from " + series.getName(), e);
        }
        mergedTimeSeries.append(series.getIndex());
        logger.info("Started merged time series {} with {}", mergedPath, series.getName());
        return mergedTimeSeries;
    }
}
