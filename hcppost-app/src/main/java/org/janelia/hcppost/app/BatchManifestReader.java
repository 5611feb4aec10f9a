package org.janelia.hcppost.app;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;
import org.janelia.hcppost.processing.exceptions.ConfigurationException;

/**
 * Reads batch manifests with one <code>subjectID,output_folder</code> entry per line.
 * Blank lines and lines starting with '#' are ignored.
 */
public class BatchManifestReader {

    private static final Splitter ENTRY_SPLITTER = Splitter.on(',').trimResults();

    public List<BatchEntry> read(Path manifest) {
        List<String> lines;
        try {
            lines = Files.readAllLines(manifest);
        } catch (IOException e) {
            throw new ConfigurationException("Error reading batch manifest " + manifest, e);
        }
        ImmutableList.Builder<BatchEntry> entries = ImmutableList.builder();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            String trimmedLine = line.trim();
            if (trimmedLine.isEmpty() || trimmedLine.startsWith("#")) {
                continue;
            }
            List<String> fields = ENTRY_SPLITTER.splitToList(trimmedLine);
            if (fields.size() != 2 || StringUtils.isAnyBlank(fields.get(0), fields.get(1))) {
                throw new ConfigurationException("Invalid entry at line " + lineNumber + " of " + manifest
                        + " - expected 'subjectID,output_folder' but found '" + line + "'");
            }
            entries.add(new BatchEntry(fields.get(0), fields.get(1)));
        }
        return entries.build();
    }
}
