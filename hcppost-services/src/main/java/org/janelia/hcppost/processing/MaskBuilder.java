package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import jakarta.inject.Inject;

import org.janelia.hcppost.config.ProjectConfig;
import org.janelia.hcppost.config.ThresholdRange;
import org.janelia.hcppost.model.MaskSet;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.model.TissueType;
import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.processing.common.ExternalToolRunner;
import org.janelia.hcppost.processing.common.ToolInvocation;
import org.janelia.hcppost.processing.common.ToolResult;
import org.janelia.hcppost.processing.exceptions.MissingInputException;
import org.janelia.hcppost.processing.tools.FslCommands;
import org.slf4j.Logger;

/**
 * Builds the eroded white matter and ventricle masks from the subject's 2mm segmentation volume.
 */
public class MaskBuilder {

    private final ExternalToolRunner toolRunner;
    private final Logger logger;

    @Inject
    public MaskBuilder(ExternalToolRunner toolRunner, Logger logger) {
        this.toolRunner = toolRunner;
        this.logger = logger;
    }

    public MaskSet build(SubjectRun subjectRun) {
        Path segmentation = subjectRun.getLayout().getSegmentationVolume();
        if (Files.notExists(segmentation)) {
            throw new MissingInputException("Segmentation volume " + segmentation + " not found");
        }
        FslCommands fsl = new FslCommands(subjectRun.getConfiguration().getEnvironment());
        ProjectConfig projectConfig = subjectRun.getConfiguration().getProject();
        Path whiteMatterMask = buildTissueMask(fsl, subjectRun, segmentation, TissueType.WHITE_MATTER,
                projectConfig.getWhiteMatterLeft(), projectConfig.getWhiteMatterRight());
        Path ventricleMask = buildTissueMask(fsl, subjectRun, segmentation, TissueType.VENTRICLE,
                projectConfig.getVentricleLeft(), projectConfig.getVentricleRight());
        return new MaskSet(whiteMatterMask, ventricleMask);
    }

    private Path buildTissueMask(FslCommands fsl, SubjectRun subjectRun, Path segmentation, TissueType tissueType,
                                 ThresholdRange leftRange, ThresholdRange rightRange) {
        Path roisDir = segmentation.getParent();
        String maskName = tissueType.getLabel() + "_2mm_" + subjectRun.getSubjectId() + "_mask";
        Path leftMask = roisDir.resolve("L_" + maskName + ".nii.gz");
        Path rightMask = roisDir.resolve("R_" + maskName + ".nii.gz");
        Path combinedMask = roisDir.resolve(maskName + ".nii.gz");
        Path erodedMask = roisDir.resolve(maskName + "_eroded.nii.gz");

        logger.info("Making {} mask {} using left range {} and right range {}", tissueType, erodedMask, leftRange, rightRange);
        try {
            runMaskOperation(fsl.threshold(segmentation, leftRange, leftMask));
            runMaskOperation(fsl.threshold(segmentation, rightRange, rightMask));
            runMaskOperation(fsl.addAndBinarize(rightMask, leftMask, combinedMask));
            runMaskOperation(fsl.erode(combinedMask, erodedMask));
        } finally {
            removeIntermediate(leftMask);
            removeIntermediate(rightMask);
            removeIntermediate(combinedMask);
        }
        if (Files.notExists(erodedMask)) {
            throw new ComputationException("Eroded " + tissueType + " mask " + erodedMask + " was not created");
        }
        return erodedMask;
    }

    private void runMaskOperation(ToolInvocation maskOperation) {
        ToolResult result = toolRunner.run(maskOperation);
        if (!result.isSuccessful()) {
            throw new ComputationException(maskOperation.toShellCommand() + " failed with exit code " + result.getExitCode());
        }
    }

    private void removeIntermediate(Path intermediateMask) {
        try {
            Files.deleteIfExists(intermediateMask);
        } catch (IOException e) {
            logger.warn("Error removing intermediate mask {}", intermediateMask, e);
        }
    }
}
