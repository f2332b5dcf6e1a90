package com.odata.writer.batch;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odata.writer.request.InMemoryRequestMessage;
import com.odata.writer.request.RequestMessage;

/**
 * {@link BatchWriter} that records its operations in memory, in creation order.
 * Multipart framing of the recorded operations is left to the transport.
 */
public class InMemoryBatchWriter implements BatchWriter {
    private static final Logger log = LoggerFactory.getLogger(InMemoryBatchWriter.class);

    private final AtomicInteger lastContentId = new AtomicInteger();
    private final ContentIdMap contentIds = new ContentIdMap();
    private final List<InMemoryRequestMessage> operations = new ArrayList<>();
    private volatile boolean started;

    @Override
    public synchronized void startBatch() {
        if (started) {
            throw new IllegalStateException("Batch has already been started");
        }
        started = true;
        log.debug("Batch started");
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public int nextContentId() {
        return lastContentId.incrementAndGet();
    }

    @Override
    public void mapContentId(Object entryData, int contentId) {
        contentIds.put(entryData, contentId);
    }

    @Override
    public Integer getContentId(Object entryData) {
        return contentIds.get(entryData);
    }

    @Override
    public synchronized RequestMessage createOperationRequestMessage(String method, URI uri) {
        if (!started) {
            throw new IllegalStateException("Batch has not been started");
        }
        InMemoryRequestMessage message = new InMemoryRequestMessage(method, uri);
        operations.add(message);
        log.debug("Batch operation {} {}", method, uri);
        return message;
    }

    public synchronized List<InMemoryRequestMessage> getOperations() {
        return Collections.unmodifiableList(new ArrayList<>(operations));
    }
}
