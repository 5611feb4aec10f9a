package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import jakarta.inject.Inject;

import org.janelia.hcppost.model.SeriesRecord;
import org.janelia.hcppost.model.SubjectLayout;
import org.janelia.hcppost.processing.exceptions.NoInputDataException;
import org.slf4j.Logger;

/**
 * Finds the raw resting state series of a subject, i.e. the <code>&lt;subject&gt;_REST&lt;n&gt;.nii[.gz]</code> files.
 * Single band reference scans and other acquisitions are skipped.
 */
public class SeriesDiscoverer {

    private final Logger logger;

    @Inject
    public SeriesDiscoverer(Logger logger) {
        this.logger = logger;
    }

    /**
     * @return the series in ascending index order
     */
    public List<SeriesRecord> discover(SubjectLayout layout) {
        Path rawDataDir = layout.getRawDataDir();
        if (!Files.isDirectory(rawDataDir)) {
            throw new NoInputDataException("Raw data directory " + rawDataDir + " not found - check the output path");
        }
        Pattern seriesPattern = Pattern.compile(Pattern.quote(layout.getSubjectId() + "_") + "REST(\\d+)\\.nii(\\.gz)?");
        List<Path> seriesCandidates;
        try (Stream<Path> rawEntries = Files.list(rawDataDir)) {
            seriesCandidates = rawEntries
                    .filter(p -> seriesPattern.matcher(p.getFileName().toString()).matches())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new NoInputDataException("Error reading raw data directory " + rawDataDir, e);
        }
        Map<Integer, Path> seriesByIndex = new HashMap<>();
        List<SeriesRecord> series = new ArrayList<>();
        for (Path rawSeries : seriesCandidates) {
            int seriesIndex = extractSeriesIndex(seriesPattern, rawSeries);
            Path previous = seriesByIndex.put(seriesIndex, rawSeries);
            if (previous != null) {
                throw new NoInputDataException("Both " + previous + " and " + rawSeries + " map to series REST" + seriesIndex);
            }
            series.add(new SeriesRecord(rawSeries, seriesIndex, layout.getSeriesResultsDir("REST" + seriesIndex)));
        }
        if (series.isEmpty()) {
            throw new NoInputDataException("No resting state series found in " + rawDataDir);
        }
        series.sort(Comparator.comparingInt(SeriesRecord::getIndex));
        logger.info("Found {} resting state series in {}: {}", series.size(), rawDataDir,
                series.stream().map(SeriesRecord::getName).collect(Collectors.joining(",")));
        return series;
    }

    private int extractSeriesIndex(Pattern seriesPattern, Path rawSeries) {
        Matcher matcher = seriesPattern.matcher(rawSeries.getFileName().toString());
        if (!matcher.matches()) {
            throw new NoInputDataException("Cannot determine the series number of " + rawSeries);
        }
        int seriesIndex = Integer.parseInt(matcher.group(1));
        if (seriesIndex < 1) {
            throw new NoInputDataException("Invalid series number in " + rawSeries);
        }
        return seriesIndex;
    }
}
