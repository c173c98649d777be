package org.vectorfill.clients.http;

import java.util.Map;

public record HttpResponse(int statusCode, String statusText, Map<String, String> headers, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** A shortened body for log and error messages. */
    public String bodySnippet() {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }

    @Override
    public String toString() {
        return "HttpResponse[" + statusCode + " " + statusText + "]";
    }
}
