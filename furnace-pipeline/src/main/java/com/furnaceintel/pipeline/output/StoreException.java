package com.furnaceintel.pipeline.output;

/** A call to the time-series store failed. */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
