package org.janelia.hcppost.processing;

import java.util.List;

import com.google.common.base.Splitter;
import jakarta.inject.Inject;

import org.janelia.hcppost.config.EnvironmentConfig;
import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.processing.common.ExternalToolRunner;
import org.janelia.hcppost.processing.common.ToolResult;
import org.janelia.hcppost.processing.exceptions.MissingInputException;
import org.janelia.hcppost.processing.tools.FslCommands;
import org.slf4j.Logger;

/**
 * Reads the repetition time (the <code>pixdim4</code> header field) of a raw series.
 */
public class RepetitionTimeReader {

    private static final Splitter FIELD_SPLITTER = Splitter.onPattern("\\s+").trimResults().omitEmptyStrings();

    private final ExternalToolRunner toolRunner;
    private final Logger logger;

    @Inject
    public RepetitionTimeReader(ExternalToolRunner toolRunner, Logger logger) {
        this.toolRunner = toolRunner;
        this.logger = logger;
    }

    public double read(EnvironmentConfig environmentConfig, SeriesRecord series) {
        ToolResult headerResult = toolRunner.run(new FslCommands(environmentConfig).header(series.getRawPath()));
        if (!headerResult.isSuccessful()) {
            throw new MissingInputException("Cannot read the header of " + series.getRawPath() + " - fslhd exited with code " + headerResult.getExitCode());
        }
        double repetitionTime = headerResult.getStdoutLines().stream()
                .map(FIELD_SPLITTER::splitToList)
                .filter(fields -> fields.size() > 1 && "pixdim4".equals(fields.get(0)))
                .map(fields -> parseRepetitionTime(series, fields))
                .findFirst()
                .orElseThrow(() -> new MissingInputException("No pixdim4 entry found in the header of " + series.getRawPath()));
        if (repetitionTime <= 0) {
            throw new MissingInputException("Invalid repetition time " + repetitionTime + " in " + series.getRawPath());
        }
        logger.info("TR for {} is {}", series.getName(), repetitionTime);
        series.setRepetitionTime(repetitionTime);
        return repetitionTime;
    }

    private double parseRepetitionTime(SeriesRecord series, List<String> headerFields) {
        try {
            return Double.parseDouble(headerFields.get(1));
        } catch (NumberFormatException e) {
            throw new MissingInputException("Invalid pixdim4 value " + headerFields.get(1) + " in " + series.getRawPath(), e);
        }
    }
}
