package com.odata.writer.format;

/**
 * Wire format of request payloads.
 */
public enum PayloadFormat {
    JSON("application/json;odata.metadata=minimal"),
    ATOM("application/atom+xml;type=entry");

    private final String contentType;

    PayloadFormat(String contentType) {
        this.contentType = contentType;
    }

    public String getContentType() {
        return contentType;
    }
}
