package org.janelia.hcppost.processing.common;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;

/**
 * A single external tool command line.
 */
public class ToolInvocation {

    public static class Builder {
        private final String toolName;
        private final List<String> commandLine = new ArrayList<>();
        private final Map<String, String> environment = new LinkedHashMap<>();
        private Duration timeout;
        private Path workingDir;

        public Builder(String toolName, String executable) {
            Preconditions.checkArgument(StringUtils.isNotBlank(executable), "No executable set for %s", toolName);
            this.toolName = toolName;
            this.commandLine.add(executable);
        }

        public Builder addArg(String arg) {
            commandLine.add(arg);
            return this;
        }

        public Builder addArg(Path arg) {
            commandLine.add(arg.toString());
            return this;
        }

        public Builder addArgs(String... args) {
            Collections.addAll(commandLine, args);
            return this;
        }

        public Builder env(String name, String value) {
            environment.put(name, value);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder workingDir(Path workingDir) {
            this.workingDir = workingDir;
            return this;
        }

        public ToolInvocation build() {
            return new ToolInvocation(toolName, commandLine, environment, timeout, workingDir);
        }
    }

    private final String toolName;
    private final List<String> commandLine;
    private final Map<String, String> environment;
    private final Duration timeout;
    private final Path workingDir;

    private ToolInvocation(String toolName, List<String> commandLine, Map<String, String> environment, Duration timeout, Path workingDir) {
        this.toolName = toolName;
        this.commandLine = Collections.unmodifiableList(new ArrayList<>(commandLine));
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        this.timeout = timeout;
        this.workingDir = workingDir;
    }

    public String getToolName() {
        return toolName;
    }

    /**
     * @return the executable followed by its arguments
     */
    public List<String> getCommandLine() {
        return commandLine;
    }

    public List<String> getArgs() {
        return commandLine.subList(1, commandLine.size());
    }

    /**
     * @return variables added to the environment inherited from the current process
     */
    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<Path> getWorkingDir() {
        return Optional.ofNullable(workingDir);
    }

    public ToolInvocation withTimeout(Duration newTimeout) {
        return new ToolInvocation(toolName, commandLine, environment, newTimeout, workingDir);
    }

    public String toShellCommand() {
        return String.join(" ", commandLine);
    }

    @Override
    public String toString() {
        return toShellCommand();
    }
}
