package org.janelia.hcppost.processing.engine;

import java.util.Optional;

import org.janelia.hcppost.processing.common.ToolTimeoutException;

public class EngineRunResult {
    private final EngineOutcome outcome;
    private final int attempts;
    private final RuntimeException lastFailure;

    private EngineRunResult(EngineOutcome outcome, int attempts, RuntimeException lastFailure) {
        this.outcome = outcome;
        this.attempts = attempts;
        this.lastFailure = lastFailure;
    }

    static EngineRunResult success(int attempts) {
        return new EngineRunResult(EngineOutcome.SUCCESS, attempts, null);
    }

    static EngineRunResult fallbackSuccess(int attempts, RuntimeException failure) {
        return new EngineRunResult(EngineOutcome.FALLBACK_SUCCESS, attempts, failure);
    }

    static EngineRunResult failure(int attempts, RuntimeException failure) {
        return new EngineRunResult(EngineOutcome.FAILURE, attempts, failure);
    }

    public EngineOutcome getOutcome() {
        return outcome;
    }

    public int getAttempts() {
        return attempts;
    }

    public Optional<RuntimeException> getLastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public boolean isSuccessful() {
        return outcome != EngineOutcome.FAILURE;
    }

    public boolean hasTimedOut() {
        return lastFailure instanceof ToolTimeoutException;
    }
}
