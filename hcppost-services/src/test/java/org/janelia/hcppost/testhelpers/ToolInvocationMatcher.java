package org.janelia.hcppost.testhelpers;

import java.util.Arrays;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.hcppost.processing.common.ToolInvocation;
import org.mockito.ArgumentMatcher;

/**
 * Matches an invocation by tool name and, if any are given, by its exact arguments.
 */
public class ToolInvocationMatcher implements ArgumentMatcher<ToolInvocation> {

    private final String toolName;
    private final Object[] args;

    public ToolInvocationMatcher(String toolName, Object... args) {
        this.toolName = toolName;
        this.args = args;
    }

    @Override
    public boolean matches(ToolInvocation argument) {
        if (argument == null || !toolName.equals(argument.getToolName())) {
            return false;
        }
        if (args.length == 0) {
            return true;
        }
        String[] expectedArgs = Arrays.stream(args).map(String::valueOf).toArray(String[]::new);
        return new EqualsBuilder().append(expectedArgs, argument.getArgs().toArray(new String[0])).build();
    }

    @Override
    public String toString() {
        return toolName + " " + ToStringBuilder.reflectionToString(args);
    }
}
