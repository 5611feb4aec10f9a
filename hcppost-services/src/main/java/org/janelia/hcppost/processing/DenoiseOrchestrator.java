package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;

import org.janelia.hcppost.cdi.qualifier.IntPropertyValue;
import org.janelia.hcppost.config.PipelineConfiguration;
import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.processing.common.ToolInvocation;
import org.janelia.hcppost.processing.engine.DenoiseEngineConfig;
import org.janelia.hcppost.processing.engine.EngineOutcome;
import org.janelia.hcppost.processing.engine.EngineRunResult;
import org.janelia.hcppost.processing.engine.NumericalEngineRunner;
import org.janelia.hcppost.processing.engine.RetryPolicy;
import org.janelia.hcppost.processing.exceptions.MissingInputException;
import org.janelia.hcppost.processing.tools.OctaveCommands;
import org.slf4j.Logger;

/**
 * Band-pass filters and regresses one series with <code>FNL_preproc_Matlab</code>.
 */
public class DenoiseOrchestrator {

    static final String ENGINE_FUNCTION = "FNL_preproc_Matlab";
    static final String ENGINE_CONFIG_FILENAME = "FNL_preproc_mat_config.json";
    static final String ENGINE_COMMAND_FILENAME = "octave_cmd.txt";

    private final NumericalEngineRunner engineRunner;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final Duration backoff;
    private final int maxAttempts;
    private final Logger logger;

    @Inject
    public DenoiseOrchestrator(NumericalEngineRunner engineRunner,
                               ObjectMapper objectMapper,
                               @IntPropertyValue(name = "Engine.Denoise.TimeoutInSeconds", defaultValue = 120) int timeoutInSeconds,
                               @IntPropertyValue(name = "Engine.Denoise.BackoffInSeconds", defaultValue = 60) int backoffInSeconds,
                               @IntPropertyValue(name = "Engine.Denoise.MaxAttempts", defaultValue = 2) int maxAttempts,
                               Logger logger) {
        this.engineRunner = engineRunner;
        this.objectMapper = objectMapper;
        this.timeout = Duration.ofSeconds(timeoutInSeconds);
        this.backoff = Duration.ofSeconds(backoffInSeconds);
        this.maxAttempts = maxAttempts;
        this.logger = logger;
    }

    public EngineRunResult denoise(SubjectRun subjectRun, SeriesRecord series) {
        PipelineConfiguration configuration = subjectRun.getConfiguration();
        Path workingDir = series.getWorkingDir();
        if (Files.notExists(series.getDenseTimeSeries())) {
            throw new MissingInputException("Dense time series " + series.getDenseTimeSeries() + " not found");
        }
        Path configFile = workingDir.resolve(ENGINE_CONFIG_FILENAME);
        ToolInvocation engineInvocation = new OctaveCommands(configuration.getEnvironment())
                .evalFunction(ENGINE_FUNCTION, configFile)
                .workingDir(workingDir)
                .build();
        try {
            logger.info("Copy {} to {}", series.getDenseTimeSeries(), series.getWorkingDenseTimeSeries());
            Files.copy(series.getDenseTimeSeries(), series.getWorkingDenseTimeSeries(), StandardCopyOption.REPLACE_EXISTING);
            Files.deleteIfExists(configFile);
            objectMapper.writeValue(configFile.toFile(),
                    new DenoiseEngineConfig(configuration.getEnvironment(), configuration.getProject(), subjectRun.getLayout(), series));
            Path commandFile = workingDir.resolve(ENGINE_COMMAND_FILENAME);
            Files.write(commandFile, (engineInvocation.toShellCommand() + "\n").getBytes(StandardCharsets.UTF_8));
            logger.info("Running {} for {} - the command line is in {}", ENGINE_FUNCTION, series.getName(), commandFile);
        } catch (IOException e) {
            throw new ComputationException("Error preparing " + ENGINE_FUNCTION + " for " + series.getName(), e);
        }
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .timeout(timeout)
                .backoff(backoff)
                .expectedOutput(workingDir.resolve(configuration.getProject().getMotionFilename()))
                .build();
        EngineRunResult result = engineRunner.runOrFail(engineInvocation, retryPolicy);
        if (result.getOutcome() == EngineOutcome.FALLBACK_SUCCESS) {
            logger.warn("{} did not complete cleanly for {} but its outputs are present", ENGINE_FUNCTION, series.getName());
        }
        series.setDenoised(true);
        return result;
    }
}
