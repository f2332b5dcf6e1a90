package com.odata.writer.encoding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odata.writer.coercion.TypeCoercionTable;
import com.odata.writer.entry.ODataCollectionValue;
import com.odata.writer.entry.ODataComplexValue;
import com.odata.writer.entry.ODataEntry;
import com.odata.writer.entry.ODataProperty;
import com.odata.writer.exception.MetadataException;
import com.odata.writer.exception.RequestWriterException;
import com.odata.writer.exception.SchemaMismatchException;
import com.odata.writer.metadata.EntryDetails;
import com.odata.writer.metadata.MetadataCatalog;
import com.odata.writer.metadata.ReferenceLink;
import com.odata.writer.model.EdmTypeReference;
import com.odata.writer.model.EntityType;
import com.odata.writer.model.SchemaModel;
import com.odata.writer.model.StructuralProperty;
import com.odata.writer.model.StructuredType;

/**
 * Builds the encoded entry tree for one entity from its parsed entry details.
 *
 * Structural properties are resolved against the model passed to {@link #encode}, which
 * is a {@link DeltaSchemaModel} for partial updates. Nothing is written here; a failure
 * leaves no partial output behind.
 */
public class EntryEncoder {
    private static final Logger log = LoggerFactory.getLogger(EntryEncoder.class);

    private final MetadataCatalog catalog;
    private final LinkEncoder linkEncoder;

    public EntryEncoder(MetadataCatalog catalog, LinkEncoder linkEncoder) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.linkEncoder = Objects.requireNonNull(linkEncoder, "linkEncoder");
    }

    public ODataEntry encode(SchemaModel model, String entityTypeName, EntryDetails entryDetails) {
        EntityType entityType = model.findEntityType(entityTypeName)
                .orElseThrow(() -> new MetadataException("Entity type " + entityTypeName + " is not declared"));

        ODataEntry.ODataEntryBuilder entry = ODataEntry.builder().typeName(entityType.getFullName());

        for (Map.Entry<String, Object> item : entryDetails.getProperties().entrySet()) {
            entry.property(encodeProperty(model, entityType, item.getKey(), item.getValue()));
        }

        for (ReferenceLink link : entryDetails.getLinks()) {
            if (link.getLinkData() != null) {
                entry.link(linkEncoder.encode(entityType.getFullName(), link.getLinkName(), link.getLinkData()));
            }
        }

        ODataEntry result = entry.build();
        log.debug("Encoded {} with {} properties and {} links",
                entityType.getName(), result.getProperties().size(), result.getLinks().size());
        return result;
    }

    private ODataProperty encodeProperty(SchemaModel model, StructuredType owner, String name, Object value) {
        StructuralProperty property = findProperty(owner, name);
        if (property == null) {
            if (owner.isOpenType()) {
                return new ODataProperty(name, value);
            }
            throw new SchemaMismatchException(owner.getFullName(), name);
        }
        return new ODataProperty(property.getName(), encodeValue(model, property.getType(), value),
                property.getType().getFullName());
    }

    private StructuralProperty findProperty(StructuredType owner, String name) {
        return owner.findProperty(name)
                .or(() -> owner.getStructuralProperties().stream()
                        .filter(p -> catalog.namesAreEqual(p.getName(), name))
                        .findFirst())
                .orElse(null);
    }

    private Object encodeValue(SchemaModel model, EdmTypeReference type, Object value) {
        if (value == null) {
            return null;
        }
        switch (type.getKind()) {
            case PRIMITIVE:
                return TypeCoercionTable.convert(value, type.getPrimitiveKind());
            case COMPLEX:
                return encodeComplex(model, type, value);
            case COLLECTION:
                return encodeCollection(model, type, value);
            default:
                return value;
        }
    }

    private ODataComplexValue encodeComplex(SchemaModel model, EdmTypeReference type, Object value) {
        StructuredType complexType = model.findStructuredType(type.getFullName())
                .orElseThrow(() -> new MetadataException("Complex type " + type.getFullName() + " is not declared"));
        if (!(value instanceof Map<?, ?> map)) {
            throw new RequestWriterException("Value of complex type " + type.getFullName()
                    + " must be a map, got " + value.getClass().getName());
        }

        List<ODataProperty> properties = new ArrayList<>();
        for (Map.Entry<?, ?> item : map.entrySet()) {
            properties.add(encodeProperty(model, complexType, String.valueOf(item.getKey()), item.getValue()));
        }
        return new ODataComplexValue(complexType.getFullName(), properties);
    }

    private ODataCollectionValue encodeCollection(SchemaModel model, EdmTypeReference type, Object value) {
        Iterable<?> items;
        if (value instanceof Iterable<?> iterable) {
            items = iterable;
        } else if (value instanceof Object[] array) {
            items = Arrays.asList(array);
        } else {
            throw new RequestWriterException("Value of collection type " + type.getFullName()
                    + " must be iterable, got " + value.getClass().getName());
        }

        EdmTypeReference elementType = type.unwrapCollection();
        List<Object> encoded = new ArrayList<>();
        for (Object item : items) {
            encoded.add(encodeValue(model, elementType, item));
        }
        return new ODataCollectionValue(type.getFullName(), encoded);
    }
}
