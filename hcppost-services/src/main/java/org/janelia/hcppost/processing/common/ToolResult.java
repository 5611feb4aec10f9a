package org.janelia.hcppost.processing.common;

import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

public class ToolResult {
    private final int exitCode;
    private final String stdout;
    private final String stderr;
    private final List<String> errors;

    public ToolResult(int exitCode, String stdout, String stderr) {
        this(exitCode, stdout, stderr, ImmutableList.of());
    }

    public ToolResult(int exitCode, String stdout, String stderr, List<String> errors) {
        this.exitCode = exitCode;
        this.stdout = stdout == null ? "" : stdout;
        this.stderr = stderr == null ? "" : stderr;
        this.errors = ImmutableList.copyOf(errors);
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStdout() {
        return stdout;
    }

    public String getStderr() {
        return stderr;
    }

    public List<String> getStdoutLines() {
        return Splitter.onPattern("\r?\n").omitEmptyStrings().splitToList(stdout);
    }

    /**
     * @return error lines found in the tool output
     */
    public List<String> getErrors() {
        return errors;
    }

    public boolean isSuccessful() {
        return exitCode == 0;
    }
}
