package org.janelia.hcppost.processing;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;

import org.janelia.hcppost.cdi.qualifier.IntPropertyValue;
import org.janelia.hcppost.config.PipelineConfiguration;
import org.janelia.hcppost.model.FinalOutputReport;
import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.model.SubjectLayout;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.processing.common.ToolInvocation;
import org.janelia.hcppost.processing.engine.AnalysesEngineConfig;
import org.janelia.hcppost.processing.engine.EngineOutcome;
import org.janelia.hcppost.processing.engine.EngineRunResult;
import org.janelia.hcppost.processing.engine.NumericalEngineRunner;
import org.janelia.hcppost.processing.engine.RetryPolicy;
import org.janelia.hcppost.processing.tools.OctaveCommands;
import org.janelia.hcppost.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Subject level steps that run once all series are merged and parcellated: framewise displacement summary,
 * the <code>analyses_v2</code> engine stage, motion files, frame counts, published links and the final
 * outputs check.
 */
public class SubjectFinalizer {

    static final String ENGINE_FUNCTION = "analyses_v2";
    static final String ENGINE_CONFIG_FILENAME = "analyses_v2_mat_config.json";
    static final String ALL_FD_FILENAME = "all_FD.txt";
    static final String FRAMES_PER_SCAN_FILENAME = "frames_per_scan.txt";
    static final String ENGINE_EXPECTED_OUTPUT = "FD_dist.png";

    private static final Pattern FD_FILE_PATTERN = Pattern.compile("FD_REST(\\d+).*\\.txt");

    private final NumericalEngineRunner engineRunner;
    private final ObjectMapper objectMapper;
    private final AnalysisLinkPublisher linkPublisher;
    private final FinalOutputsVerifier outputsVerifier;
    private final Duration timeout;
    private final Duration backoff;
    private final int maxAttempts;
    private final Logger logger;

    @Inject
    public SubjectFinalizer(NumericalEngineRunner engineRunner,
                            ObjectMapper objectMapper,
                            AnalysisLinkPublisher linkPublisher,
                            FinalOutputsVerifier outputsVerifier,
                            @IntPropertyValue(name = "Engine.Analyses.TimeoutInSeconds", defaultValue = 800) int timeoutInSeconds,
                            @IntPropertyValue(name = "Engine.Analyses.BackoffInSeconds", defaultValue = 600) int backoffInSeconds,
                            @IntPropertyValue(name = "Engine.Analyses.MaxAttempts", defaultValue = 2) int maxAttempts,
                            Logger logger) {
        this.engineRunner = engineRunner;
        this.objectMapper = objectMapper;
        this.linkPublisher = linkPublisher;
        this.outputsVerifier = outputsVerifier;
        this.timeout = Duration.ofSeconds(timeoutInSeconds);
        this.backoff = Duration.ofSeconds(backoffInSeconds);
        this.maxAttempts = maxAttempts;
        this.logger = logger;
    }

    public FinalOutputReport finalizeSubject(SubjectRun subjectRun) {
        SubjectLayout layout = subjectRun.getLayout();
        concatenateFramewiseDisplacements(layout);
        runAnalysesStage(subjectRun);
        copyMotionFiles(layout);
        writeFramesPerScan(subjectRun);
        linkPublisher.publish(subjectRun);
        return outputsVerifier.verify(layout);
    }

    Path concatenateFramewiseDisplacements(SubjectLayout layout) {
        Path allFdFile = layout.getSummaryDir().resolve(ALL_FD_FILENAME);
        List<Path> fdFiles;
        try (Stream<Path> fdFileStream = FileUtils.lookupFiles(layout.getSummaryDir(), 1, "glob:FD_REST*.txt")) {
            fdFiles = fdFileStream
                    .sorted(Comparator.comparingInt(SubjectFinalizer::fdSeriesIndex).thenComparing(Path::getFileName))
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw new ComputationException("Error looking up framewise displacement files in " + layout.getSummaryDir(), e);
        }
        logger.info("Concatenating {} into {}", fdFiles, allFdFile);
        try {
            Files.deleteIfExists(allFdFile);
            Files.createFile(allFdFile);
            for (Path fdFile : fdFiles) {
                Files.write(allFdFile, Files.readAllBytes(fdFile), StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            throw new ComputationException("Error writing " + allFdFile, e);
        }
        return allFdFile;
    }

    private static int fdSeriesIndex(Path fdFile) {
        Matcher matcher = FD_FILE_PATTERN.matcher(fdFile.getFileName().toString());
        return matcher.matches() ? Integer.parseInt(matcher.group(1)) : Integer.MAX_VALUE;
    }

    EngineRunResult runAnalysesStage(SubjectRun subjectRun) {
        PipelineConfiguration configuration = subjectRun.getConfiguration();
        SubjectLayout layout = subjectRun.getLayout();
        Path configFile = layout.getMatlabCodeDir().resolve(ENGINE_CONFIG_FILENAME);
        try {
            objectMapper.writeValue(configFile.toFile(),
                    new AnalysesEngineConfig(configuration.getEnvironment(), configuration.getProject(), layout, getRepetitionTime(subjectRun)));
        } catch (IOException e) {
            throw new ComputationException("Error writing " + configFile, e);
        }
        ToolInvocation engineInvocation = new OctaveCommands(configuration.getEnvironment())
                .evalFunction(ENGINE_FUNCTION, configFile, configuration.getEnvironment().getHcpMatlabDirectory())
                .workingDir(layout.getMatlabCodeDir())
                .build();
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .timeout(timeout)
                .backoff(backoff)
                .expectedOutput(layout.getSummaryDir().resolve(ENGINE_EXPECTED_OUTPUT))
                .build();
        logger.info("Running {} for {} (this takes several minutes)", ENGINE_FUNCTION, subjectRun.getSubjectId());
        EngineRunResult result = engineRunner.runOrFail(engineInvocation, retryPolicy);
        if (result.getOutcome() == EngineOutcome.FALLBACK_SUCCESS) {
            logger.warn("{} did not complete cleanly for {} but its final output is present", ENGINE_FUNCTION, subjectRun.getSubjectId());
        }
        return result;
    }

    private double getRepetitionTime(SubjectRun subjectRun) {
        List<Double> repetitionTimes = subjectRun.getIncludedSeries().stream()
                .map(SeriesRecord::getRepetitionTime)
                .filter(tr -> tr != null)
                .collect(Collectors.toList());
        if (repetitionTimes.isEmpty()) {
            throw new ComputationException("No repetition time is known for any series of " + subjectRun.getSubjectId());
        }
        double repetitionTime = repetitionTimes.get(0);
        if (repetitionTimes.stream().distinct().count() > 1) {
            logger.warn("Series of {} have different repetition times {} - using {}", subjectRun.getSubjectId(), repetitionTimes, repetitionTime);
        }
        return repetitionTime;
    }

    List<Path> copyMotionFiles(SubjectLayout layout) {
        List<Path> copied = new ArrayList<>();
        try (Stream<Path> matFiles = FileUtils.lookupFiles(layout.getMatlabCodeDir(), 1, "glob:*.mat")) {
            for (Path matFile : matFiles.sorted().collect(Collectors.toList())) {
                Path target = layout.getMotionDir().resolve(matFile.getFileName());
                Files.copy(matFile, target, StandardCopyOption.REPLACE_EXISTING);
                copied.add(target);
            }
        } catch (IOException | UncheckedIOException e) {
            throw new ComputationException("Error copying motion files to " + layout.getMotionDir(), e);
        }
        logger.info("Copied {} motion files to {}", copied.size(), layout.getMotionDir());
        return copied;
    }

    Path writeFramesPerScan(SubjectRun subjectRun) {
        Path framesPerScanFile = subjectRun.getLayout().getSummaryDir().resolve(FRAMES_PER_SCAN_FILENAME);
        List<String> frameCounts = new ArrayList<>();
        try {
            for (SeriesRecord series : subjectRun.getIncludedSeries()) {
                frameCounts.add(String.valueOf(FileUtils.countLines(series.getRegressorFile())));
            }
            Files.write(framesPerScanFile, frameCounts, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ComputationException("Error writing " + framesPerScanFile, e);
        }
        return framesPerScanFile;
    }
}
