package org.janelia.hcppost.model;

import java.nio.file.Path;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Project, visit and pipeline a subject's data belongs to.
 */
public class SubjectMetadata {
    private final String projectName;
    private final String visitId;
    private final String pipelineName;
    private final Path studyRoot;

    public SubjectMetadata(String projectName, String visitId, String pipelineName, Path studyRoot) {
        this.projectName = projectName;
        this.visitId = visitId;
        this.pipelineName = pipelineName;
        this.studyRoot = studyRoot;
    }

    public String getProjectName() {
        return projectName;
    }

    public String getVisitId() {
        return visitId;
    }

    public String getPipelineName() {
        return pipelineName;
    }

    /**
     * @return the project directory under which the shared <code>analyses_v2</code> link tree lives
     */
    public Path getStudyRoot() {
        return studyRoot;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("projectName", projectName)
                .append("visitId", visitId)
                .append("pipelineName", pipelineName)
                .append("studyRoot", studyRoot)
                .toString();
    }
}
