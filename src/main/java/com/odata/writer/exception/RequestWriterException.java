package com.odata.writer.exception;

/**
 * Base type for failures raised while encoding a request body.
 *
 * Errors are local to a single write; nothing is retried here.
 */
public class RequestWriterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RequestWriterException(String message) {
        super(message);
    }

    public RequestWriterException(String message, Throwable cause) {
        super(message, cause);
    }
}
