package org.vectorfill.pipeline.checkpoint;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import org.vectorfill.pipeline.ir.PipelineState;

/**
 * Durable record of run progress. There is one state per session id; saving replaces it.
 */
public interface CheckpointStore {

    /** Atomically replace the saved state of {@code state.sessionId()}. */
    void save(PipelineState state) throws IOException;

    /**
     * @return the saved state, or empty when the session has none
     * @throws CheckpointCorruptedException when a state exists but cannot be read
     */
    Optional<PipelineState> load(String sessionId) throws IOException;

    /** Session id of the most recently updated state, if any. */
    Optional<String> latestSessionId() throws IOException;

    List<String> list() throws IOException;
}
