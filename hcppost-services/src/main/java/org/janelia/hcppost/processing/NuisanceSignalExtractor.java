package org.janelia.hcppost.processing;

import java.nio.file.Files;
import java.nio.file.Path;

import jakarta.inject.Inject;

import org.janelia.hcppost.model.MaskSet;
import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.model.TissueType;
import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.processing.common.ExternalToolRunner;
import org.janelia.hcppost.processing.common.ToolInvocation;
import org.janelia.hcppost.processing.common.ToolResult;
import org.janelia.hcppost.processing.exceptions.ExtractionException;
import org.janelia.hcppost.processing.tools.FslCommands;
import org.slf4j.Logger;

/**
 * Computes the mean ventricle and white matter time courses of a series, used as nuisance regressors.
 */
public class NuisanceSignalExtractor {

    private final ExternalToolRunner toolRunner;
    private final Logger logger;

    @Inject
    public NuisanceSignalExtractor(ExternalToolRunner toolRunner, Logger logger) {
        this.toolRunner = toolRunner;
        this.logger = logger;
    }

    public void extract(SubjectRun subjectRun, SeriesRecord series) {
        MaskSet maskSet = subjectRun.getMaskSet();
        if (maskSet == null || !maskSet.isComplete()) {
            throw new ExtractionException("Tissue masks are not available for " + series.getName());
        }
        FslCommands fsl = new FslCommands(subjectRun.getConfiguration().getEnvironment());
        series.setVentricleMeanFile(extractMean(fsl, series, TissueType.VENTRICLE, maskSet.getMask(TissueType.VENTRICLE)));
        series.setWhiteMatterMeanFile(extractMean(fsl, series, TissueType.WHITE_MATTER, maskSet.getMask(TissueType.WHITE_MATTER)));
    }

    private Path extractMean(FslCommands fsl, SeriesRecord series, TissueType tissueType, Path mask) {
        Path meanFile = series.getWorkingDir().resolve(series.getName() + "_" + tissueType.getLabel() + "_mean.txt");
        ToolInvocation meanInvocation = fsl.meanTimeSeries(series.getFunctionalVolume(), meanFile, mask);
        ToolResult result;
        try {
            result = toolRunner.run(meanInvocation);
        } catch (ComputationException e) {
            throw new ExtractionException("Error extracting the " + tissueType + " mean signal of " + series.getName(), e);
        }
        if (!result.isSuccessful() || Files.notExists(meanFile)) {
            throw new ExtractionException("Extracting the " + tissueType + " mean signal of " + series.getName()
                    + " failed with exit code " + result.getExitCode());
        }
        logger.debug("Extracted {} mean signal {}", tissueType, meanFile);
        return meanFile;
    }
}
