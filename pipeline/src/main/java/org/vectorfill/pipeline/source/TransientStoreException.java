package org.vectorfill.pipeline.source;

/**
 * The store could not serve a request right now (overloaded, 429, 5xx). Worth retrying.
 */
public class TransientStoreException extends RuntimeException {
    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
