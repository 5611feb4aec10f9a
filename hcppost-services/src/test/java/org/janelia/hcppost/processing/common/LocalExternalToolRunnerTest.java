package org.janelia.hcppost.processing.common;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;

import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;

public class LocalExternalToolRunnerTest {

    private static final String SHELL = "/bin/sh";

    private LocalExternalToolRunner toolRunner;

    @Before
    public void setUp() {
        Assume.assumeTrue(Files.isExecutable(Paths.get(SHELL)));
        toolRunner = new LocalExternalToolRunner(mock(Logger.class));
    }

    @Test
    public void captureOutput() {
        ToolResult result = toolRunner.run(new ToolInvocation.Builder("sh", SHELL)
                .addArgs("-c", "echo $HCPPOST_TEST_VALUE; echo progress >&2")
                .env("HCPPOST_TEST_VALUE", "valid")
                .build());
        assertTrue(result.isSuccessful());
        assertThat(result.getStdoutLines(), contains("valid"));
        assertThat(result.getStderr().trim(), equalTo("progress"));
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    public void nonZeroExitAndErrorLines() {
        ToolResult result = toolRunner.run(new ToolInvocation.Builder("sh", SHELL)
                .addArgs("-c", "echo 'Segmentation fault' >&2; exit 3")
                .build());
        assertFalse(result.isSuccessful());
        assertThat(result.getExitCode(), equalTo(3));
        assertThat(result.getErrors(), contains("Segmentation fault"));
    }

    @Test(expected = ToolTimeoutException.class)
    public void toolIsTerminatedAfterTimeout() {
        toolRunner.run(new ToolInvocation.Builder("sh", SHELL)
                .addArgs("-c", "sleep 10")
                .timeout(Duration.ofMillis(200))
                .build());
    }

    @Test(expected = ComputationException.class)
    public void missingExecutable() {
        toolRunner.run(new ToolInvocation.Builder("missing", "/nonexistent/tool").build());
    }
}
