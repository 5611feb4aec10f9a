package org.janelia.hcppost.processing.common;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import jakarta.inject.Inject;

import org.apache.commons.collections4.MapUtils;
import org.slf4j.Logger;

/**
 * Runs the tools as local processes. The process output is collected in temporary files that are removed once the
 * process completes.
 */
public class LocalExternalToolRunner implements ExternalToolRunner {

    private final ToolErrorChecker errorChecker;
    private final Logger logger;

    @Inject
    public LocalExternalToolRunner(Logger logger) {
        this.errorChecker = new ToolErrorChecker(logger);
        this.logger = logger;
    }

    @Override
    public ToolResult run(ToolInvocation invocation) {
        Path processOutput = null;
        Path processError = null;
        Process process = null;
        try {
            processOutput = Files.createTempFile("hcppost-" + invocation.getToolName(), ".out");
            processError = Files.createTempFile("hcppost-" + invocation.getToolName(), ".err");
            ProcessBuilder processBuilder = new ProcessBuilder(invocation.getCommandLine())
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(processOutput.toFile()))
                    .redirectError(ProcessBuilder.Redirect.appendTo(processError.toFile()));
            invocation.getWorkingDir().ifPresent(workingDir -> processBuilder.directory(workingDir.toFile()));
            if (MapUtils.isNotEmpty(invocation.getEnvironment())) {
                processBuilder.environment().putAll(invocation.getEnvironment());
            }

            logger.info("Start {}{}", invocation.toShellCommand(), invocation.getWorkingDir().map(d -> " in " + d).orElse(""));
            process = processBuilder.start();
            Optional<Duration> timeout = invocation.getTimeout();
            if (timeout.isPresent()) {
                if (!process.waitFor(timeout.get().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("{} did not complete in {}s - terminate it", invocation.getToolName(), timeout.get().getSeconds());
                    process.destroyForcibly();
                    throw new ToolTimeoutException(invocation.getToolName(), timeout.get());
                }
            } else {
                process.waitFor();
            }
            String stdout = new String(Files.readAllBytes(processOutput), StandardCharsets.UTF_8);
            String stderr = new String(Files.readAllBytes(processError), StandardCharsets.UTF_8);
            List<String> errors = errorChecker.collectErrors(stdout, stderr);
            int exitCode = process.exitValue();
            logger.info("{} completed with exit code {}", invocation.getToolName(), exitCode);
            return new ToolResult(exitCode, stdout, stderr, errors);
        } catch (IOException e) {
            logger.error("Error running {}", invocation.toShellCommand(), e);
            throw new ComputationException("Error running " + invocation.getToolName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new ComputationException("Interrupted while waiting for " + invocation.getToolName(), e);
        } finally {
            deleteOutputFile(processOutput);
            deleteOutputFile(processError);
        }
    }

    private void deleteOutputFile(Path outputFile) {
        if (outputFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(outputFile);
        } catch (IOException e) {
            logger.warn("Error removing process output file {}", outputFile, e);
        }
    }
}
