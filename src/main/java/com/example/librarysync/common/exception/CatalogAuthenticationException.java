package com.example.librarysync.common.exception;

public class CatalogAuthenticationException extends NonRetriableSyncException {

    private final int statusCode;

    public CatalogAuthenticationException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
