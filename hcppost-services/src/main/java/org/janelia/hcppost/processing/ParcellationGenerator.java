package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import jakarta.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.janelia.hcppost.cdi.qualifier.StrPropertyValue;
import org.janelia.hcppost.model.MergedTimeSeries;
import org.janelia.hcppost.model.MissingAtlasWarning;
import org.janelia.hcppost.model.ParcellationArtifact;
import org.janelia.hcppost.model.ParcellationResult;
import org.janelia.hcppost.model.ParcellationVariant;
import org.janelia.hcppost.model.SubjectLayout;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.processing.common.ExternalToolRunner;
import org.janelia.hcppost.processing.common.ToolInvocation;
import org.janelia.hcppost.processing.common.ToolResult;
import org.janelia.hcppost.processing.exceptions.MissingInputException;
import org.janelia.hcppost.processing.tools.WorkbenchCommands;
import org.slf4j.Logger;

/**
 * Parcellates the merged dense time series with every atlas found in the site's label directory. Every generated
 * file, the merged series included, is registered in the subject's spec file.
 */
public class ParcellationGenerator {

    private static final String ATLAS_PLACEHOLDER = "{atlas}";

    private final ExternalToolRunner toolRunner;
    private final String combinedLabelPattern;
    private final String subcorticalOnlyLabelPattern;
    private final Logger logger;

    @Inject
    public ParcellationGenerator(ExternalToolRunner toolRunner,
                                 @StrPropertyValue(name = "Parcellation.CombinedLabelPattern",
                                         defaultValue = "{atlas}.subcortical.32k_fs_LR.dlabel.nii") String combinedLabelPattern,
                                 @StrPropertyValue(name = "Parcellation.SubcorticalOnlyLabelPattern",
                                         defaultValue = "{atlas}.subcortical.32k_fs_LR.dlabel.nii") String subcorticalOnlyLabelPattern,
                                 Logger logger) {
        this.toolRunner = toolRunner;
        this.combinedLabelPattern = combinedLabelPattern;
        this.subcorticalOnlyLabelPattern = subcorticalOnlyLabelPattern;
        this.logger = logger;
    }

    public ParcellationResult generate(SubjectRun subjectRun) {
        MergedTimeSeries mergedTimeSeries = subjectRun.getMergedTimeSeries();
        if (mergedTimeSeries == null || Files.notExists(mergedTimeSeries.getPath())) {
            throw new MissingInputException("No merged time series available for " + subjectRun.getSubjectId());
        }
        SubjectLayout layout = subjectRun.getLayout();
        WorkbenchCommands workbench = new WorkbenchCommands(subjectRun.getConfiguration().getEnvironment());
        logger.info("Adding merged time series {} to {}", mergedTimeSeries.getPath(), layout.getSpecFile());
        runWorkbench(workbench.addToSpecFile(layout.getSpecFile(), mergedTimeSeries.getPath()));

        Path labelDirectory = subjectRun.getConfiguration().getEnvironment().getLabelDirectory();
        List<String> atlasNames = listAtlases(labelDirectory);
        List<ParcellationArtifact> artifacts = new ArrayList<>();
        List<MissingAtlasWarning> warnings = new ArrayList<>();
        for (String atlasName : atlasNames) {
            for (ParcellationVariant variant : ParcellationVariant.values()) {
                Path labelFile = labelDirectory.resolve(atlasName).resolve("fsLR").resolve(getLabelFileName(atlasName, variant));
                if (Files.notExists(labelFile)) {
                    MissingAtlasWarning warning = new MissingAtlasWarning(atlasName, variant, labelFile);
                    logger.warn("{}", warning);
                    warnings.add(warning);
                    if (variant == ParcellationVariant.COMBINED) {
                        // an atlas without the combined labels is skipped entirely
                        break;
                    }
                    continue;
                }
                Path output = layout.getParcellatedTimeSeries(atlasName, variant);
                logger.info("Creating {} parcellation {} using {}", variant, output, labelFile);
                runWorkbench(workbench.ciftiParcellate(mergedTimeSeries.getPath(), labelFile, output));
                runWorkbench(workbench.addToSpecFile(layout.getSpecFile(), output));
                artifacts.add(new ParcellationArtifact(atlasName, variant, labelFile, output));
            }
        }
        subjectRun.addParcellations(artifacts);
        return new ParcellationResult(artifacts, warnings);
    }

    String getLabelFileName(String atlasName, ParcellationVariant variant) {
        String pattern = variant == ParcellationVariant.COMBINED ? combinedLabelPattern : subcorticalOnlyLabelPattern;
        return StringUtils.replace(pattern, ATLAS_PLACEHOLDER, atlasName);
    }

    private List<String> listAtlases(Path labelDirectory) {
        if (!Files.isDirectory(labelDirectory)) {
            throw new MissingInputException("Label directory " + labelDirectory + " not found");
        }
        try (Stream<Path> labelEntries = Files.list(labelDirectory)) {
            return labelEntries
                    .filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MissingInputException("Error reading label directory " + labelDirectory, e);
        }
    }

    private void runWorkbench(ToolInvocation invocation) {
        ToolResult result = toolRunner.run(invocation);
        if (!result.isSuccessful()) {
            throw new ComputationException(invocation.toShellCommand() + " failed with exit code " + result.getExitCode());
        }
    }
}
