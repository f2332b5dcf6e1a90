package com.odata.writer.request;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.util.Map;

/**
 * One outgoing request: method, target URI, headers and a body sink.
 */
public interface RequestMessage {

    String getMethod();

    URI getUri();

    void setHeader(String name, String value);

    /**
     * Header value, or null when the header is not set. Names are case-insensitive.
     */
    String getHeader(String name);

    Map<String, String> getHeaders();

    /**
     * Sink the payload is written to.
     */
    OutputStream getBody();

    /**
     * A fresh stream over everything written to the body so far.
     */
    InputStream getStream();
}
