package org.vectorfill.pipeline.ir;

import java.util.List;
import java.util.Map;

/**
 * Per-document acknowledgement of a bulk write.
 *
 * @param written ids the store accepted
 * @param failed  ids the store rejected, with the store's reason
 */
public record WriteAck(List<String> written, Map<String, String> failed) {
    public WriteAck {
        written = List.copyOf(written);
        failed = Map.copyOf(failed);
    }

    public static WriteAck empty() {
        return new WriteAck(List.of(), Map.of());
    }

    public static WriteAck allWritten(List<String> ids) {
        return new WriteAck(ids, Map.of());
    }
}
