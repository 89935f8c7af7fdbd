package com.example.librarysync.common.exception;

public class CatalogTransportException extends RuntimeException {

    private final int statusCode;

    public CatalogTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public CatalogTransportException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or -1 when the request never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
