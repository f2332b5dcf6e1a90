package com.odata.writer.batch;

import java.net.URI;

import com.odata.writer.request.RequestMessage;

/**
 * Collects the operations of one batch request.
 *
 * Content ids are allocated monotonically and are unique within the batch. Entity data
 * maps are associated with their content id by identity so that later operations in the
 * same batch can link to entities that do not exist on the server yet.
 */
public interface BatchWriter {

    /**
     * Begin the batch. Must be called once, before the first operation is created.
     */
    void startBatch();

    boolean isStarted();

    int nextContentId();

    void mapContentId(Object entryData, int contentId);

    /**
     * Content id previously mapped to this exact entry data instance, or null.
     */
    Integer getContentId(Object entryData);

    RequestMessage createOperationRequestMessage(String method, URI uri);
}
