package org.janelia.hcppost.processing.engine;

import jakarta.inject.Inject;

import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.processing.common.ExternalToolRunner;
import org.janelia.hcppost.processing.common.ToolInvocation;
import org.janelia.hcppost.processing.common.ToolResult;
import org.janelia.hcppost.processing.exceptions.EngineTimeoutException;
import org.slf4j.Logger;

/**
 * Runs an engine stage under a {@link RetryPolicy}. After every failed attempt the expected output is checked first
 * and only if it is absent the stage is retried after the policy's backoff.
 */
public class NumericalEngineRunner {

    private final ExternalToolRunner toolRunner;
    private final Logger logger;

    @Inject
    public NumericalEngineRunner(ExternalToolRunner toolRunner, Logger logger) {
        this.toolRunner = toolRunner;
        this.logger = logger;
    }

    public EngineRunResult run(ToolInvocation engineInvocation, RetryPolicy retryPolicy) {
        ToolInvocation invocation = engineInvocation.withTimeout(retryPolicy.getTimeout());
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 1) {
                waitBeforeRetry(invocation, retryPolicy);
            }
            try {
                ToolResult result = toolRunner.run(invocation);
                if (result.isSuccessful()) {
                    logger.info("{} completed after {} attempt(s)", invocation.getToolName(), attempt);
                    return EngineRunResult.success(attempt);
                }
                lastFailure = new ComputationException(invocation.getToolName() + " exited with code " + result.getExitCode()
                        + (result.getErrors().isEmpty() ? "" : ": " + result.getErrors()));
            } catch (ComputationException e) {
                lastFailure = e;
            }
            if (retryPolicy.isExpectedOutputPresent()) {
                logger.warn("{} failed on attempt {} ({}) but its output {} is present - accept it",
                        invocation.getToolName(), attempt, lastFailure.getMessage(), retryPolicy.getExpectedOutput());
                return EngineRunResult.fallbackSuccess(attempt, lastFailure);
            }
            logger.warn("{} failed on attempt {} of {}: {}",
                    invocation.getToolName(), attempt, retryPolicy.getMaxAttempts(), lastFailure.getMessage());
        }
        return EngineRunResult.failure(retryPolicy.getMaxAttempts(), lastFailure);
    }

    /**
     * Same as {@link #run(ToolInvocation, RetryPolicy)} but a failed stage raises an exception.
     *
     * @throws EngineTimeoutException if the last attempt timed out
     * @throws ComputationException if the last attempt failed for any other reason
     */
    public EngineRunResult runOrFail(ToolInvocation engineInvocation, RetryPolicy retryPolicy) {
        EngineRunResult result = run(engineInvocation, retryPolicy);
        if (result.isSuccessful()) {
            return result;
        }
        String message = engineInvocation.getToolName() + " failed after " + result.getAttempts()
                + " attempt(s) and " + retryPolicy.getExpectedOutput() + " was not found";
        RuntimeException cause = result.getLastFailure().orElse(null);
        if (result.hasTimedOut()) {
            throw new EngineTimeoutException(message, cause);
        } else {
            throw new ComputationException(message, cause);
        }
    }

    private void waitBeforeRetry(ToolInvocation invocation, RetryPolicy retryPolicy) {
        long backoffMillis = retryPolicy.getBackoff().toMillis();
        if (backoffMillis <= 0) {
            return;
        }
        logger.info("Wait {}s before retrying {}", retryPolicy.getBackoff().getSeconds(), invocation.getToolName());
        try {
            Thread.sleep(backoffMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationException("Interrupted while waiting to retry " + invocation.getToolName(), e);
        }
    }
}
