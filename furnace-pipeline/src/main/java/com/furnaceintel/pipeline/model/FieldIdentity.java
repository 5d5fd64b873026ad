package com.furnaceintel.pipeline.model;

/** Where a raw variable lands in the store: measurement plus field key. */
public record FieldIdentity(String measurement, String field) {}
