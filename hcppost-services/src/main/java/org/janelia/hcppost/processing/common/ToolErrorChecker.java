package org.janelia.hcppost.processing.common;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Scans the output of an external tool for lines that report errors.
 */
public class ToolErrorChecker {

    private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n").omitEmptyStrings();

    private final Logger logger;

    public ToolErrorChecker(Logger logger) {
        this.logger = logger;
    }

    public List<String> collectErrors(String stdout, String stderr) {
        List<String> errors = new ArrayList<>();
        processOutput(stdout, getStdOutConsumer(errors));
        processOutput(stderr, getStdErrConsumer(errors));
        return errors;
    }

    private void processOutput(String output, Consumer<String> lineConsumer) {
        if (StringUtils.isEmpty(output)) {
            return;
        }
        LINE_SPLITTER.split(output).forEach(lineConsumer);
    }

    private Consumer<String> getStdOutConsumer(List<String> errors) {
        return (String s) -> {
            logger.debug(s);
            if (hasErrors(s)) {
                logger.error(s);
                errors.add(s);
            }
        };
    }

    private Consumer<String> getStdErrConsumer(List<String> errors) {
        return (String s) -> {
            logger.info(s); // many of the imaging tools write progress to stderr
            if (hasErrors(s)) {
                logger.error(s);
                errors.add(s);
            }
        };
    }

    boolean hasErrors(String l) {
        return StringUtils.isNotBlank(l) && l.matches("(?i:.*(error|exception|Segmentation fault|core dumped).*)");
    }
}
