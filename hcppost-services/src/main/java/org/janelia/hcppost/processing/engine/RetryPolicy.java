package org.janelia.hcppost.processing.engine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * How an engine stage is retried. A failed attempt is accepted anyway when the stage's expected output is already
 * on disk.
 */
public class RetryPolicy {

    public static class Builder {
        private int maxAttempts = 2;
        private Duration timeout;
        private Duration backoff = Duration.ZERO;
        private Path expectedOutput;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder backoff(Duration backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder expectedOutput(Path expectedOutput) {
            this.expectedOutput = expectedOutput;
            return this;
        }

        public RetryPolicy build() {
            Preconditions.checkArgument(maxAttempts > 0, "Max attempts must be positive");
            Preconditions.checkNotNull(timeout, "Engine timeout is required");
            Preconditions.checkNotNull(expectedOutput, "Expected engine output is required");
            return new RetryPolicy(this);
        }
    }

    private final int maxAttempts;
    private final Duration timeout;
    private final Duration backoff;
    private final Path expectedOutput;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.timeout = builder.timeout;
        this.backoff = builder.backoff;
        this.expectedOutput = builder.expectedOutput;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getBackoff() {
        return backoff;
    }

    public Path getExpectedOutput() {
        return expectedOutput;
    }

    public boolean isExpectedOutputPresent() {
        return Files.exists(expectedOutput);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("maxAttempts", maxAttempts)
                .append("timeout", timeout)
                .append("backoff", backoff)
                .append("expectedOutput", expectedOutput)
                .toString();
    }
}
