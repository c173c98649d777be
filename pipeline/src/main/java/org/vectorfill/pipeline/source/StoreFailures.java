package org.vectorfill.pipeline.source;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

public final class StoreFailures {

    private StoreFailures() {}

    /** Whether a store read or write failure is worth another attempt. */
    public static boolean isTransient(Throwable t) {
        return t instanceof TransientStoreException
            || t instanceof IOException
            || t instanceof TimeoutException;
    }
}
