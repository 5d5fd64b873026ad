package com.furnaceintel.pipeline.service;

/** The upstream API could not deliver a payload. */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
