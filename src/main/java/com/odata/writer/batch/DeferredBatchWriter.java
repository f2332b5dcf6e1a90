package com.odata.writer.batch;

import java.net.URI;
import java.util.Objects;
import java.util.function.Supplier;

import com.odata.writer.request.HttpLiteral;
import com.odata.writer.request.RequestMessage;

/**
 * Lazily created batch writer. The underlying writer is created on first use and its
 * batch is started exactly once, by whichever caller gets there first; concurrent
 * callers wait for the start to complete.
 */
public class DeferredBatchWriter {
    private final Supplier<? extends BatchWriter> factory;
    private final Object lock = new Object();
    private BatchWriter value;
    private boolean started;

    public DeferredBatchWriter(Supplier<? extends BatchWriter> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public static DeferredBatchWriter of(BatchWriter writer) {
        Objects.requireNonNull(writer, "writer");
        return new DeferredBatchWriter(() -> writer);
    }

    public boolean isValueCreated() {
        synchronized (lock) {
            return value != null;
        }
    }

    /**
     * The underlying writer, created if needed. Does not start the batch.
     */
    public BatchWriter getValue() {
        synchronized (lock) {
            if (value == null) {
                value = Objects.requireNonNull(factory.get(), "batch writer factory returned null");
            }
            return value;
        }
    }

    /**
     * The underlying writer with its batch started.
     */
    public BatchWriter ensureStarted() {
        synchronized (lock) {
            BatchWriter writer = getValue();
            if (!started) {
                writer.startBatch();
                started = true;
            }
            return writer;
        }
    }

    /**
     * Start the batch if needed and add one operation to it. When {@code entryData} is not
     * null the operation also gets the next content id, mapped to {@code entryData} and set
     * as its {@code Content-ID} header. Runs under the same lock as the batch start, so
     * content ids rise in the order operations are added.
     */
    public RequestMessage addOperation(String method, URI uri, Object entryData) {
        synchronized (lock) {
            BatchWriter writer = ensureStarted();
            RequestMessage message = writer.createOperationRequestMessage(method, uri);
            if (entryData != null) {
                int contentId = writer.nextContentId();
                writer.mapContentId(entryData, contentId);
                message.setHeader(HttpLiteral.CONTENT_ID, String.valueOf(contentId));
            }
            return message;
        }
    }

    public boolean isStarted() {
        synchronized (lock) {
            return started;
        }
    }
}
