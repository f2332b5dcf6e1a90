package com.odata.writer.request;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odata.writer.batch.BatchWriter;
import com.odata.writer.batch.DeferredBatchWriter;
import com.odata.writer.encoding.DeltaSchemaModel;
import com.odata.writer.encoding.EntryEncoder;
import com.odata.writer.encoding.LinkEncoder;
import com.odata.writer.entry.ODataEntry;
import com.odata.writer.exception.MetadataException;
import com.odata.writer.format.PayloadSerializer;
import com.odata.writer.format.PayloadSerializers;
import com.odata.writer.metadata.EntryDetails;
import com.odata.writer.metadata.MetadataCatalog;
import com.odata.writer.model.EntitySet;
import com.odata.writer.model.EntityType;
import com.odata.writer.model.SchemaModel;

/**
 * Writes entity request bodies, either as standalone requests or as operations of a batch.
 *
 * Outside a batch every call produces a fresh in-memory stream and shares no mutable
 * state with other calls. Inside a batch the body goes into the batch operation, and
 * every non-delete operation gets a content id that later operations can link to.
 */
public class RequestWriter {
    private static final Logger log = LoggerFactory.getLogger(RequestWriter.class);

    private static final String UNSAFE_URI_CHARS = "\"<>\\^`{|}";

    private final WriterSettings settings;
    private final MetadataCatalog catalog;
    private final DeferredBatchWriter batchWriter;
    private final PayloadSerializer serializer;

    public RequestWriter(WriterSettings settings, MetadataCatalog catalog) {
        this(settings, catalog, null);
    }

    /**
     * @param batchWriter the batch to write into, or null for standalone requests
     */
    public RequestWriter(WriterSettings settings, MetadataCatalog catalog, DeferredBatchWriter batchWriter) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.batchWriter = batchWriter;
        this.serializer = PayloadSerializers.create(settings);
    }

    public boolean isBatch() {
        return batchWriter != null;
    }

    /**
     * Write the body of an entity request.
     *
     * @param method      HTTP method, e.g. POST, PUT, PATCH or DELETE
     * @param collection  entity set name as supplied by the caller
     * @param entryData   property and link values of the entity
     * @param commandText request path relative to the url base, e.g. {@code Orders(1)}
     * @return the serialized body for standalone requests; null inside a batch and for DELETE
     */
    public InputStream writeEntryContent(String method, String collection, Map<String, ?> entryData,
                                         String commandText) {
        RequestMessage message = writeEntry(method, collection, entryData, commandText);
        if (isBatch() || HttpLiteral.DELETE.equalsIgnoreCase(method)) {
            return null;
        }
        return message.getStream();
    }

    /**
     * Same as {@link #writeEntryContent} but returns the whole message, headers included.
     */
    public RequestMessage writeEntry(String method, String collection, Map<String, ?> entryData,
                                     String commandText) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(collection, "collection");

        boolean delete = HttpLiteral.DELETE.equalsIgnoreCase(method);
        Map<String, ?> data = entryData == null ? Map.of() : entryData;

        // encode first: a failure must not leave an operation half written
        byte[] body = delete ? null : encode(method, collection, data);

        RequestMessage message = isBatch()
                ? createOperationRequestMessage(method, collection, data, commandText)
                : new InMemoryRequestMessage(method, toUri(commandText));
        if (!isBatch()) {
            applyConcurrencyHeader(message, method, collection);
        }

        if (body != null) {
            message.setHeader(HttpLiteral.CONTENT_TYPE, serializer.getContentType());
            writeBody(message, body);
        }
        log.debug("{} {} written ({} bytes)", method, commandText, body == null ? 0 : body.length);
        return message;
    }

    /**
     * Write the body of a standalone entity reference link request.
     */
    public InputStream writeLinkContent(String linkPath) {
        Objects.requireNonNull(linkPath, "linkPath");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            serializer.writeReferenceLink(linkPath, buffer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write reference link " + linkPath, e);
        }
        InMemoryRequestMessage message = new InMemoryRequestMessage(HttpLiteral.POST, null);
        writeBody(message, buffer.toByteArray());
        return message.getStream();
    }

    /**
     * Build the encoded entry tree without serializing it.
     */
    public ODataEntry encodeEntry(String method, String collection, Map<String, ?> entryData) {
        EntitySet entitySet = catalog.getConcreteEntityCollection(collection);
        SchemaModel model = catalog.getModel();
        EntityType entityType = model.findEntityType(entitySet.getEntityTypeName())
                .orElseThrow(() -> new MetadataException("Entity type " + entitySet.getEntityTypeName()
                        + " of set " + entitySet.getName() + " is not declared"));

        SchemaModel writeModel = HttpLiteral.PATCH.equalsIgnoreCase(method)
                ? new DeltaSchemaModel(model, entityType, entryData.keySet(), catalog.getPluralizer())
                : model;

        BatchWriter batch = isBatch() ? batchWriter.getValue() : null;
        Integer contentId = batch != null ? batch.getContentId(entryData) : null;
        EntryDetails details = catalog.parseEntryDetails(entitySet.getName(), entryData, contentId);

        String typeName = catalog.getEntitySetTypeNamespace(collection) + "." + catalog.getEntitySetTypeName(collection);
        EntryEncoder encoder = new EntryEncoder(catalog, new LinkEncoder(catalog, batch));
        return encoder.encode(writeModel, typeName, details);
    }

    private byte[] encode(String method, String collection, Map<String, ?> entryData) {
        ODataEntry entry = encodeEntry(method, collection, entryData);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            serializer.writeEntry(entry, buffer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize entry of " + collection, e);
        }
        return buffer.toByteArray();
    }

    private RequestMessage createOperationRequestMessage(String method, String collection, Map<String, ?> entryData,
                                                         String commandText) {
        boolean delete = HttpLiteral.DELETE.equalsIgnoreCase(method);
        RequestMessage message = batchWriter.addOperation(method, toUri(commandText), delete ? null : entryData);
        applyConcurrencyHeader(message, method, collection);
        return message;
    }

    private void applyConcurrencyHeader(RequestMessage message, String method, String collection) {
        if (HttpLiteral.isUpdateOrDelete(method) && catalog.entitySetTypeRequiresOptimisticConcurrencyCheck(collection)) {
            message.setHeader(HttpLiteral.IF_MATCH, HttpLiteral.ANY_ETAG);
        }
    }

    private URI toUri(String commandText) {
        String uri = settings.resolve(commandText);
        StringBuilder escaped = new StringBuilder(uri.length());
        for (char c : uri.toCharArray()) {
            if (c <= 0x20 || UNSAFE_URI_CHARS.indexOf(c) >= 0) {
                escaped.append('%').append(String.format("%02X", (int) c));
            } else {
                escaped.append(c);
            }
        }
        return URI.create(escaped.toString());
    }

    private static void writeBody(RequestMessage message, byte[] body) {
        try {
            message.getBody().write(body);
            message.getBody().flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write request body", e);
        }
    }
}
