package org.janelia.hcppost.processing;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import jakarta.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.janelia.hcppost.cdi.qualifier.StrPropertyValue;
import org.janelia.hcppost.config.PipelineConfiguration;
import org.janelia.hcppost.config.PipelineConfigurationResolver;
import org.janelia.hcppost.config.RegressorFailurePolicy;
import org.janelia.hcppost.config.Site;
import org.janelia.hcppost.config.SiteResolver;
import org.janelia.hcppost.config.Study;
import org.janelia.hcppost.model.FinalOutputReport;
import org.janelia.hcppost.model.ParcellationResult;
import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.model.SubjectLayout;
import org.janelia.hcppost.model.SubjectMetadata;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.model.SubjectRunStatus;
import org.janelia.hcppost.processing.exceptions.InvalidRegressorException;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Post-processes one subject end to end. Any fatal condition is raised as a
 * {@link org.janelia.hcppost.processing.common.ComputationException}.
 */
public class SubjectPostProcessor {

    static final String SUBJECT_MDC_KEY = "subject";

    private final SiteResolver siteResolver;
    private final SubjectMetadataResolver metadataResolver;
    private final PipelineConfigurationResolver configurationResolver;
    private final SeriesDiscoverer seriesDiscoverer;
    private final DirectoryLifecycleManager directoryManager;
    private final RegressorValidator regressorValidator;
    private final MaskBuilder maskBuilder;
    private final RepetitionTimeReader repetitionTimeReader;
    private final NuisanceSignalExtractor nuisanceSignalExtractor;
    private final DenoiseOrchestrator denoiseOrchestrator;
    private final MergeEngine mergeEngine;
    private final ParcellationGenerator parcellationGenerator;
    private final SubjectFinalizer subjectFinalizer;
    private final RegressorFailurePolicy regressorFailurePolicy;
    private final Logger logger;

    @Inject
    public SubjectPostProcessor(SiteResolver siteResolver,
                                SubjectMetadataResolver metadataResolver,
                                PipelineConfigurationResolver configurationResolver,
                                SeriesDiscoverer seriesDiscoverer,
                                DirectoryLifecycleManager directoryManager,
                                RegressorValidator regressorValidator,
                                MaskBuilder maskBuilder,
                                RepetitionTimeReader repetitionTimeReader,
                                NuisanceSignalExtractor nuisanceSignalExtractor,
                                DenoiseOrchestrator denoiseOrchestrator,
                                MergeEngine mergeEngine,
                                ParcellationGenerator parcellationGenerator,
                                SubjectFinalizer subjectFinalizer,
                                @StrPropertyValue(name = "Regressor.FailurePolicy", defaultValue = "ABORT_RUN") String regressorFailurePolicy,
                                Logger logger) {
        this.siteResolver = siteResolver;
        this.metadataResolver = metadataResolver;
        this.configurationResolver = configurationResolver;
        this.seriesDiscoverer = seriesDiscoverer;
        this.directoryManager = directoryManager;
        this.regressorValidator = regressorValidator;
        this.maskBuilder = maskBuilder;
        this.repetitionTimeReader = repetitionTimeReader;
        this.nuisanceSignalExtractor = nuisanceSignalExtractor;
        this.denoiseOrchestrator = denoiseOrchestrator;
        this.mergeEngine = mergeEngine;
        this.parcellationGenerator = parcellationGenerator;
        this.subjectFinalizer = subjectFinalizer;
        this.regressorFailurePolicy = RegressorFailurePolicy.fromName(regressorFailurePolicy);
        this.logger = logger;
    }

    /**
     * @param studyName study to use instead of the one inferred from the output path; may be null
     */
    public FinalOutputReport process(String subjectId, Path outputPath, String studyName) {
        String currentSubjectContext = MDC.get(SUBJECT_MDC_KEY);
        MDC.put(SUBJECT_MDC_KEY, subjectId);
        try {
            return processSubject(subjectId, outputPath.toAbsolutePath().normalize(), studyName);
        } finally {
            if (currentSubjectContext != null) {
                MDC.put(SUBJECT_MDC_KEY, currentSubjectContext);
            } else {
                MDC.remove(SUBJECT_MDC_KEY);
            }
        }
    }

    private FinalOutputReport processSubject(String subjectId, Path outputPath, String studyName) {
        LocalDateTime startTime = LocalDateTime.now();
        SubjectRun subjectRun = createSubjectRun(subjectId, outputPath, studyName);
        SubjectLayout layout = subjectRun.getLayout();

        List<SeriesRecord> series = seriesDiscoverer.discover(layout);
        subjectRun.setSeries(series);
        logger.info("Start processing {} in {} with {} resting state series at {}", subjectId, outputPath, series.size(), startTime);

        directoryManager.prepare(layout, series);
        subjectRun.advanceTo(SubjectRunStatus.DIRECTORIES_PREPARED);

        checkRegressors(subjectRun);

        subjectRun.setMaskSet(maskBuilder.build(subjectRun));
        subjectRun.advanceTo(SubjectRunStatus.MASKS_READY);

        for (SeriesRecord seriesRecord : subjectRun.getIncludedSeries()) {
            logger.info("Processing {}", seriesRecord.getName());
            repetitionTimeReader.read(subjectRun.getConfiguration().getEnvironment(), seriesRecord);
            nuisanceSignalExtractor.extract(subjectRun, seriesRecord);
            denoiseOrchestrator.denoise(subjectRun, seriesRecord);
            mergeEngine.merge(subjectRun, seriesRecord);
        }
        subjectRun.advanceTo(SubjectRunStatus.SERIES_PROCESSED);
        subjectRun.advanceTo(SubjectRunStatus.MERGED);

        ParcellationResult parcellationResult = parcellationGenerator.generate(subjectRun);
        logger.info("Created {} parcellations, skipped {} atlas variants", parcellationResult.getArtifacts().size(), parcellationResult.getWarnings().size());
        subjectRun.advanceTo(SubjectRunStatus.PARCELLATED);

        FinalOutputReport report = subjectFinalizer.finalizeSubject(subjectRun);
        subjectRun.advanceTo(SubjectRunStatus.FINALIZED);

        LocalDateTime endTime = LocalDateTime.now();
        logger.info("Done with {} at {} - elapsed time {}s, {} of {} expected outputs missing",
                subjectId, endTime, Duration.between(startTime, endTime).getSeconds(),
                report.getMissingOutputs().size(), report.getExpectedOutputs().size());
        return report;
    }

    private SubjectRun createSubjectRun(String subjectId, Path outputPath, String studyName) {
        Site site = siteResolver.resolve(outputPath);
        SubjectMetadata metadata = metadataResolver.resolve(outputPath, subjectId);
        Study study = Study.fromName(StringUtils.isNotBlank(studyName) ? studyName : metadata.getProjectName());
        logger.info("Subject {} belongs to {} - using site {} and study {}", subjectId, metadata, site, study);
        PipelineConfiguration configuration = configurationResolver.resolve(site, study);
        return new SubjectRun(new SubjectLayout(outputPath, subjectId), configuration, metadata);
    }

    /**
     * Every series is checked before any of them is processed.
     */
    private void checkRegressors(SubjectRun subjectRun) {
        for (SeriesRecord seriesRecord : subjectRun.getSeries()) {
            if (regressorValidator.validate(subjectRun.getConfiguration().getEnvironment(), seriesRecord)) {
                continue;
            }
            if (regressorFailurePolicy == RegressorFailurePolicy.ABORT_RUN) {
                throw new InvalidRegressorException("Movement regressor file " + seriesRecord.getRegressorFile()
                        + " is invalid - " + subjectRun.getSubjectId() + " cannot be processed");
            }
            logger.warn("Excluding {} because its movement regressor file {} is invalid", seriesRecord.getName(), seriesRecord.getRegressorFile());
            seriesRecord.setExcluded(true);
        }
        if (subjectRun.getIncludedSeries().isEmpty()) {
            throw new InvalidRegressorException("No series of " + subjectRun.getSubjectId() + " has a valid movement regressor file");
        }
    }
}
