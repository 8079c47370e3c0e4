package com.ragsync.ingest;

import java.io.IOException;

public class RemoteCallException extends IOException {
    private static final long serialVersionUID = 1L;

    private final String service;
    private final int statusCode;
    private final String responseBody;

    public RemoteCallException(String service, int statusCode, String responseBody) {
        super(service + " request failed (" + statusCode + "): " + responseBody);
        this.service = service;
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public RemoteCallException(String service, String message) {
        super(service + " request failed: " + message);
        this.service = service;
        this.statusCode = -1;
        this.responseBody = "";
    }

    public RemoteCallException(String service, String message, Throwable cause) {
        super(service + " request failed: " + message, cause);
        this.service = service;
        this.statusCode = -1;
        this.responseBody = "";
    }

    public String service() {
        return service;
    }

    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }
}
