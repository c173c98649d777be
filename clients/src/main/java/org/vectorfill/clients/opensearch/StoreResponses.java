package org.vectorfill.clients.opensearch;

import org.vectorfill.clients.http.HttpResponse;
import org.vectorfill.pipeline.source.TransientStoreException;

import reactor.core.publisher.Mono;

/**
 * Status handling shared by the store adapters: 429 and 5xx are worth retrying, other non-2xx
 * responses are not.
 */
final class StoreResponses {

    private StoreResponses() {}

    static boolean isRetryableStatus(int statusCode) {
        return statusCode == 429 || statusCode >= 500;
    }

    static Mono<HttpResponse> requireSuccess(HttpResponse response, String operation) {
        if (response.isSuccess()) {
            return Mono.just(response);
        }
        var message = operation + " returned " + response.statusCode() + " " + response.statusText()
            + ": " + response.bodySnippet();
        if (isRetryableStatus(response.statusCode())) {
            return Mono.error(new TransientStoreException(message));
        }
        return Mono.error(new StoreRequestException(response.statusCode(), message));
    }

    /** Connection resets, timeouts and the like surface as retryable store failures. */
    static Throwable asStoreFailure(Throwable error, String operation) {
        if (error instanceof TransientStoreException || error instanceof StoreRequestException
            || error instanceof BulkUpdateSection.DeserializationException) {
            return error;
        }
        return new TransientStoreException(operation + " failed: " + error, error);
    }
}
