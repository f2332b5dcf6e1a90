package com.odata.writer.model;

public enum ConcurrencyMode {
    NONE,
    /**
     * Property participates in optimistic concurrency checks (ETag).
     */
    FIXED
}
