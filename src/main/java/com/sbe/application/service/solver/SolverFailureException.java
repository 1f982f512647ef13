package com.sbe.application.service.solver;

/**
 * The solver produced no usable assignment for a chunk
 */
public class SolverFailureException extends Exception {

    private final String chunkId;

    public SolverFailureException(String chunkId, String message) {
        super(message);
        this.chunkId = chunkId;
    }

    public SolverFailureException(String chunkId, String message, Throwable cause) {
        super(message, cause);
        this.chunkId = chunkId;
    }

    public String getChunkId() {
        return chunkId;
    }
}
