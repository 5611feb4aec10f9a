package org.janelia.hcppost.config;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands <code>${name}</code> references inside configuration values. Unknown references are left as they are.
 */
public class ConfigValueResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    public String resolve(String value, Function<String, String> valueProvider) {
        return resolve(value, valueProvider, new HashSet<>());
    }

    private String resolve(String value, Function<String, String> valueProvider, Set<String> visited) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuffer resolved = new StringBuffer();
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement;
            if (visited.contains(key)) {
                // circular reference
                replacement = matcher.group();
            } else {
                String referencedValue = valueProvider.apply(key);
                if (referencedValue == null) {
                    replacement = matcher.group();
                } else {
                    visited.add(key);
                    replacement = resolve(referencedValue, valueProvider, visited);
                    visited.remove(key);
                }
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }
}
