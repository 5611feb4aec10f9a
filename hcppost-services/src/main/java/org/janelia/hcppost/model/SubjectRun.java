package org.janelia.hcppost.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.janelia.hcppost.config.PipelineConfiguration;

/**
 * State of the post-processing of one subject.
 */
public class SubjectRun {
    private final SubjectLayout layout;
    private final PipelineConfiguration configuration;
    private final SubjectMetadata metadata;
    private final List<SeriesRecord> series = new ArrayList<>();
    private SubjectRunStatus status = SubjectRunStatus.CREATED;
    private MaskSet maskSet;
    private MergedTimeSeries mergedTimeSeries;
    private final List<ParcellationArtifact> parcellations = new ArrayList<>();

    public SubjectRun(SubjectLayout layout, PipelineConfiguration configuration, SubjectMetadata metadata) {
        this.layout = layout;
        this.configuration = configuration;
        this.metadata = metadata;
    }

    public String getSubjectId() {
        return layout.getSubjectId();
    }

    public SubjectLayout getLayout() {
        return layout;
    }

    public PipelineConfiguration getConfiguration() {
        return configuration;
    }

    public SubjectMetadata getMetadata() {
        return metadata;
    }

    public List<SeriesRecord> getSeries() {
        return Collections.unmodifiableList(series);
    }

    public void setSeries(List<SeriesRecord> series) {
        this.series.clear();
        this.series.addAll(series);
    }

    /**
     * @return the series that were not excluded, in ascending index order
     */
    public List<SeriesRecord> getIncludedSeries() {
        return series.stream().filter(s -> !s.isExcluded()).collect(Collectors.toList());
    }

    public SubjectRunStatus getStatus() {
        return status;
    }

    public void advanceTo(SubjectRunStatus nextStatus) {
        if (nextStatus.compareTo(status) < 0) {
            throw new IllegalStateException("Subject run " + getSubjectId() + " cannot go from " + status + " back to " + nextStatus);
        }
        this.status = nextStatus;
    }

    public MaskSet getMaskSet() {
        return maskSet;
    }

    public void setMaskSet(MaskSet maskSet) {
        this.maskSet = maskSet;
    }

    public MergedTimeSeries getMergedTimeSeries() {
        return mergedTimeSeries;
    }

    public void setMergedTimeSeries(MergedTimeSeries mergedTimeSeries) {
        this.mergedTimeSeries = mergedTimeSeries;
    }

    public List<ParcellationArtifact> getParcellations() {
        return Collections.unmodifiableList(parcellations);
    }

    public void addParcellations(List<ParcellationArtifact> artifacts) {
        parcellations.addAll(artifacts);
    }
}
