package com.furnaceintel.pipeline.service;

/** The upstream payload is not a well-formed list-of-mappings literal. */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }
}
