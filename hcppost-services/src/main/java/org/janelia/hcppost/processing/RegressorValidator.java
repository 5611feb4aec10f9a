package org.janelia.hcppost.processing;

import java.nio.file.Files;

import jakarta.inject.Inject;

import org.apache.commons.lang3.StringUtils;
import org.janelia.hcppost.config.EnvironmentConfig;
import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.processing.common.ExternalToolRunner;
import org.janelia.hcppost.processing.common.ToolResult;
import org.janelia.hcppost.processing.exceptions.MissingRegressorException;
import org.janelia.hcppost.processing.tools.RegressorCheckCommands;
import org.slf4j.Logger;

/**
 * Checks a series' movement regressors with the site's regressor checker, which prints <code>valid</code> for a
 * usable regressor file.
 */
public class RegressorValidator {

    private static final String VALID_REGRESSOR_RESPONSE = "valid";

    private final ExternalToolRunner toolRunner;
    private final Logger logger;

    @Inject
    public RegressorValidator(ExternalToolRunner toolRunner, Logger logger) {
        this.toolRunner = toolRunner;
        this.logger = logger;
    }

    /**
     * Records the outcome in the series and returns it.
     *
     * @throws MissingRegressorException if the series has no regressor file
     */
    public boolean validate(EnvironmentConfig environmentConfig, SeriesRecord series) {
        if (Files.notExists(series.getRegressorFile())) {
            throw new MissingRegressorException("Missing movement regressor file " + series.getRegressorFile() + " for " + series.getName());
        }
        ToolResult checkResult = toolRunner.run(new RegressorCheckCommands(environmentConfig).check(series.getRawPath(), series.getRegressorFile()));
        boolean valid = checkResult.isSuccessful() && VALID_REGRESSOR_RESPONSE.equals(StringUtils.trim(checkResult.getStdout()));
        if (valid) {
            logger.info("Movement regressor file is valid for {}", series.getName());
        } else {
            logger.warn("Movement regressor file {} is invalid for {}: exit code {}, output '{}'",
                    series.getRegressorFile(), series.getName(), checkResult.getExitCode(), StringUtils.trim(checkResult.getStdout()));
        }
        series.setRegressorValid(valid);
        return valid;
    }
}
