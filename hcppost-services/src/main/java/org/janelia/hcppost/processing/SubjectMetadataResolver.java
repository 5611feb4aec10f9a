package org.janelia.hcppost.processing;

import java.nio.file.Path;

import org.janelia.hcppost.model.SubjectMetadata;

/**
 * Determines which project, visit and pipeline a subject output folder belongs to.
 */
public interface SubjectMetadataResolver {
    /**
     * @throws org.janelia.hcppost.processing.exceptions.ConfigurationException if the metadata cannot be determined
     */
    SubjectMetadata resolve(Path outputPath, String subjectId);
}
