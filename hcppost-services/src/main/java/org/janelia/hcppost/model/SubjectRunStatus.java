package org.janelia.hcppost.model;

/**
 * Lifecycle of a subject run, in processing order.
 */
public enum SubjectRunStatus {
    CREATED,
    DIRECTORIES_PREPARED,
    MASKS_READY,
    SERIES_PROCESSED,
    MERGED,
    PARCELLATED,
    FINALIZED
}
