package com.odata.writer.exception;

/**
 * Malformed or inconsistent service metadata.
 */
public class MetadataException extends RequestWriterException {

    private static final long serialVersionUID = 1L;

    public MetadataException(String message) {
        super(message);
    }

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
