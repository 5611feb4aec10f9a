package org.janelia.hcppost.processing;

import java.nio.file.Path;

import org.janelia.hcppost.model.SubjectMetadata;
import org.janelia.hcppost.processing.exceptions.ConfigurationException;

/**
 * Reads the metadata from the folder structure
 * <code>.../&lt;project&gt;/&lt;subject&gt;/&lt;visit&gt;/&lt;pipeline&gt;[/&lt;subject&gt;]</code>.
 */
public class PathSubjectMetadataResolver implements SubjectMetadataResolver {

    @Override
    public SubjectMetadata resolve(Path outputPath, String subjectId) {
        Path location = outputPath.toAbsolutePath().normalize();
        if (location.getFileName() != null && location.getFileName().toString().equals(subjectId)) {
            location = location.getParent();
        }
        if (location == null || location.getNameCount() < 4) {
            throw new ConfigurationException("Cannot determine project, visit and pipeline from " + outputPath);
        }
        int nameCount = location.getNameCount();
        String pipelineName = location.getName(nameCount - 1).toString();
        if (!pipelineName.contains("HCP")) {
            throw new ConfigurationException("Only data processed by an HCP pipeline can be post-processed - found "
                    + pipelineName + " in " + outputPath);
        }
        String visitId = location.getName(nameCount - 2).toString();
        Path studyRoot = location.getParent().getParent().getParent();
        String projectName = studyRoot.getFileName().toString();
        return new SubjectMetadata(projectName, visitId, pipelineName, studyRoot);
    }
}
