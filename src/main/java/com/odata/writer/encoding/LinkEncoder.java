package com.odata.writer.encoding;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odata.writer.batch.BatchWriter;
import com.odata.writer.entry.LinkReference;
import com.odata.writer.entry.ODataNavigationLink;
import com.odata.writer.exception.MetadataException;
import com.odata.writer.exception.MissingNavigationTargetException;
import com.odata.writer.exception.RequestWriterException;
import com.odata.writer.exception.SchemaMismatchException;
import com.odata.writer.metadata.MetadataCatalog;
import com.odata.writer.model.EntitySet;
import com.odata.writer.model.EntityType;
import com.odata.writer.model.Multiplicity;
import com.odata.writer.model.NavigationProperty;
import com.odata.writer.model.SchemaModel;

/**
 * Encodes one navigation value as a link to the target entity.
 *
 * Targets created earlier in the same batch are addressed by content id; anything else
 * is addressed through its entity set and key. Navigation properties are always looked
 * up in the catalog's full model so partners stay visible for partial updates.
 */
public class LinkEncoder {
    private static final Logger log = LoggerFactory.getLogger(LinkEncoder.class);

    private final MetadataCatalog catalog;
    private final BatchWriter batchWriter;

    /**
     * @param batchWriter writer of the active batch, or null outside a batch
     */
    public LinkEncoder(MetadataCatalog catalog, BatchWriter batchWriter) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.batchWriter = batchWriter;
    }

    public ODataNavigationLink encode(String entityTypeName, String linkName, Object linkData) {
        SchemaModel model = catalog.getModel();
        EntityType entityType = model.findEntityType(entityTypeName)
                .orElseThrow(() -> new MetadataException("Entity type " + entityTypeName + " is not declared"));

        NavigationProperty navigation = entityType.getNavigationProperties().stream()
                .filter(p -> catalog.namesAreEqual(p.getName(), linkName))
                .findFirst()
                .orElseThrow(() -> new SchemaMismatchException(entityTypeName, linkName));

        boolean isCollection = model.findPartner(navigation)
                .map(partner -> partner.getTargetMultiplicity() == Multiplicity.MANY)
                .orElse(false);

        String targetTypeName = navigation.getTargetTypeName();
        EntityType targetType = model.findEntityType(targetTypeName)
                .orElseThrow(() -> new MetadataException("Entity type " + targetTypeName + " is not declared"));

        Integer contentId = batchWriter != null ? batchWriter.getContentId(linkData) : null;
        LinkReference reference = contentId != null
                ? LinkReference.pending(contentId)
                : resolve(navigation.getName(), targetType, linkData);

        log.debug("Link {}.{} -> {}", entityType.getName(), navigation.getName(), reference.toUri());

        return ODataNavigationLink.builder()
                .name(navigation.getName())
                .collection(isCollection)
                .targetMultiplicity(navigation.getTargetMultiplicity())
                .targetTypeName(targetTypeName)
                .reference(reference)
                .build();
    }

    private LinkReference resolve(String linkName, EntityType targetType, Object linkData) {
        Map<?, ?> linkEntry = asEntryData(linkName, linkData);

        EntitySet entitySet = catalog.getModel().entitySets()
                .filter(set -> catalog.namesAreEqual(set.getEntityTypeSimpleName(), targetType.getName()))
                .findFirst()
                .orElseThrow(() -> new MissingNavigationTargetException(linkName, targetType.getFullName()));

        Map<String, Object> keyValues = new LinkedHashMap<>();
        for (String keyName : targetType.getDeclaredKey()) {
            keyValues.put(keyName, keyValue(linkName, linkEntry, keyName));
        }
        return LinkReference.resolved(entitySet.getName(), catalog.convertKeyToUriLiteral(keyValues));
    }

    private Object keyValue(String linkName, Map<?, ?> linkEntry, String keyName) {
        if (linkEntry.containsKey(keyName)) {
            return linkEntry.get(keyName);
        }
        return linkEntry.entrySet().stream()
                .filter(e -> e.getKey() != null && catalog.namesAreEqual(keyName, e.getKey().toString()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new RequestWriterException(
                        "Link " + linkName + " is missing key property " + keyName));
    }

    private static Map<?, ?> asEntryData(String linkName, Object linkData) {
        if (linkData instanceof Map<?, ?> map) {
            return map;
        }
        throw new RequestWriterException("Link " + linkName + " must reference an entity data map, got "
                + (linkData == null ? "null" : linkData.getClass().getName()));
    }
}
