package org.janelia.hcppost.processing.engine;

public enum EngineOutcome {
    SUCCESS,
    /** The engine failed but its expected output was found. */
    FALLBACK_SUCCESS,
    FAILURE
}
