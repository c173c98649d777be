package org.vectorfill.pipeline.source;

/**
 * A whole page read or bulk write kept failing after every retry. Ends the run; the checkpoint
 * stays at the last acknowledged batch.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
