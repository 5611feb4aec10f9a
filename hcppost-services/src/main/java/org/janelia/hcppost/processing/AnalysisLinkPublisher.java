package org.janelia.hcppost.processing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;
import jakarta.inject.Inject;

import org.janelia.hcppost.model.SubjectLayout;
import org.janelia.hcppost.model.SubjectMetadata;
import org.janelia.hcppost.model.SubjectRun;
import org.janelia.hcppost.processing.common.ComputationException;
import org.janelia.hcppost.utils.FileUtils;
import org.slf4j.Logger;

/**
 * Publishes a subject's analysis outputs as symbolic links in the study wide tree
 * <code>&lt;study root&gt;/analyses_v2/&lt;pipeline&gt;/&lt;subject&gt;+&lt;visit&gt;</code>.
 */
public class AnalysisLinkPublisher {

    private final Logger logger;

    @Inject
    public AnalysisLinkPublisher(Logger logger) {
        this.logger = logger;
    }

    public Path getAnalysisFolder(SubjectRun subjectRun) {
        SubjectMetadata metadata = subjectRun.getMetadata();
        return metadata.getStudyRoot()
                .resolve("analyses_v2")
                .resolve(metadata.getPipelineName())
                .resolve(subjectRun.getSubjectId() + "+" + metadata.getVisitId());
    }

    /**
     * @return the created links
     */
    public List<Path> publish(SubjectRun subjectRun) {
        SubjectLayout layout = subjectRun.getLayout();
        Path analysisFolder = getAnalysisFolder(subjectRun);
        ImmutableList.Builder<Path> links = ImmutableList.builder();
        try {
            if (Files.exists(analysisFolder, LinkOption.NOFOLLOW_LINKS)) {
                logger.info("Removing analysis folder {} from a previous run", analysisFolder);
                FileUtils.deletePath(analysisFolder);
            }
            Files.createDirectories(analysisFolder);
            links.add(link(layout.getMergedDenseTimeSeries(), layout.getWorkbenchDir()));
            links.add(link(layout.getSpecFile(), layout.getWorkbenchDir()));
            links.add(link(layout.getSummaryDir(), analysisFolder));
            for (String analysesSubdir : SubjectLayout.ANALYSES_SUBDIRS) {
                links.add(link(layout.getAnalysesSubdir(analysesSubdir), analysisFolder));
            }
        } catch (IOException e) {
            throw new ComputationException("Error publishing the analysis links of " + subjectRun.getSubjectId() + " to " + analysisFolder, e);
        }
        return links.build();
    }

    private Path link(Path target, Path linkDir) throws IOException {
        Path link = linkDir.resolve(target.getFileName());
        Files.deleteIfExists(link);
        Files.createSymbolicLink(link, target.toAbsolutePath());
        logger.debug("Linked {} -> {}", link, target);
        return link;
    }
}
