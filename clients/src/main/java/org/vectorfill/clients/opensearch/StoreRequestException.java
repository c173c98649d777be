package org.vectorfill.clients.opensearch;

/**
 * The store refused a request for a reason that retrying will not fix (bad query, missing index,
 * authentication).
 */
public class StoreRequestException extends RuntimeException {

    private final int statusCode;

    public StoreRequestException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
