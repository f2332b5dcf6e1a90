package com.odata.writer.request;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import lombok.ToString;

/**
 * {@link RequestMessage} that buffers its body in memory.
 */
@ToString(exclude = "body")
public class InMemoryRequestMessage implements RequestMessage {
    private final String method;
    private final URI uri;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();

    public InMemoryRequestMessage(String method, URI uri) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = uri;
    }

    @Override
    public String getMethod() {
        return method;
    }

    @Override
    public URI getUri() {
        return uri;
    }

    @Override
    public synchronized void setHeader(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public synchronized String getHeader(String name) {
        return headers.get(name);
    }

    @Override
    public synchronized Map<String, String> getHeaders() {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public OutputStream getBody() {
        return body;
    }

    @Override
    public InputStream getStream() {
        return new ByteArrayInputStream(body.toByteArray());
    }

    public byte[] getBodyBytes() {
        return body.toByteArray();
    }
}
