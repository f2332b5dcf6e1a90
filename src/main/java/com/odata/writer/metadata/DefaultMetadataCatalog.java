package com.odata.writer.metadata;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odata.writer.exception.MetadataException;
import com.odata.writer.model.EntitySet;
import com.odata.writer.model.EntityType;
import com.odata.writer.model.SchemaModel;
import com.odata.writer.util.NamingUtil;
import com.odata.writer.util.Pluralizer;

/**
 * {@link MetadataCatalog} backed by an in-memory {@link SchemaModel}.
 */
public class DefaultMetadataCatalog implements MetadataCatalog {
    private static final Logger log = LoggerFactory.getLogger(DefaultMetadataCatalog.class);

    private final SchemaModel model;
    private final Pluralizer pluralizer;
    private final UriLiteralFormatter literalFormatter = new UriLiteralFormatter();

    public DefaultMetadataCatalog(SchemaModel model, Pluralizer pluralizer) {
        this.model = Objects.requireNonNull(model, "model");
        this.pluralizer = pluralizer;
    }

    @Override
    public SchemaModel getModel() {
        return model;
    }

    @Override
    public Pluralizer getPluralizer() {
        return pluralizer;
    }

    @Override
    public EntitySet getConcreteEntityCollection(String collectionName) {
        Objects.requireNonNull(collectionName, "collectionName");
        // "Products/ODataDemo.FeaturedProduct" style paths address the base set
        String setName = collectionName.contains("/")
                ? collectionName.substring(0, collectionName.indexOf('/'))
                : collectionName;

        return model.entitySets()
                .filter(set -> set.getName().equals(setName))
                .findFirst()
                .or(() -> model.entitySets()
                        .filter(set -> namesAreEqual(set.getName(), setName))
                        .findFirst())
                .orElseThrow(() -> new MetadataException("Entity collection not found: " + collectionName));
    }

    @Override
    public String getEntitySetTypeNamespace(String collectionName) {
        String typeName = getConcreteEntityCollection(collectionName).getEntityTypeName();
        int dot = typeName.lastIndexOf('.');
        return dot < 0 ? "" : typeName.substring(0, dot);
    }

    @Override
    public String getEntitySetTypeName(String collectionName) {
        return getConcreteEntityCollection(collectionName).getEntityTypeSimpleName();
    }

    @Override
    public boolean entitySetTypeRequiresOptimisticConcurrencyCheck(String collectionName) {
        return findEntityType(collectionName).hasConcurrencyTokens();
    }

    @Override
    public EntryDetails parseEntryDetails(String collectionName, Map<String, ?> entryData, Integer contentId) {
        EntityType entityType = findEntityType(collectionName);
        EntryDetails details = new EntryDetails(contentId);

        for (Map.Entry<String, ?> item : entryData.entrySet()) {
            boolean isLink = entityType.getNavigationProperties().stream()
                    .anyMatch(nav -> namesAreEqual(nav.getName(), item.getKey()));
            if (!isLink) {
                details.addProperty(item.getKey(), item.getValue());
            } else if (item.getValue() instanceof Collection<?> targets) {
                for (Object target : targets) {
                    details.addLink(item.getKey(), target);
                }
            } else if (item.getValue() instanceof Object[] targets) {
                for (Object target : targets) {
                    details.addLink(item.getKey(), target);
                }
            } else {
                details.addLink(item.getKey(), item.getValue());
            }
        }

        log.debug("Parsed entry for {}: {} properties, {} links",
                collectionName, details.getProperties().size(), details.getLinks().size());
        return details;
    }

    @Override
    public String convertKeyToUriLiteral(Map<String, ?> keyValues) {
        return literalFormatter.formatKey(keyValues);
    }

    @Override
    public boolean namesAreEqual(String actualName, String requestedName) {
        return NamingUtil.namesAreEqual(actualName, requestedName, pluralizer);
    }

    private EntityType findEntityType(String collectionName) {
        EntitySet entitySet = getConcreteEntityCollection(collectionName);
        return model.findEntityType(entitySet.getEntityTypeName())
                .orElseThrow(() -> new MetadataException(
                        "Entity type " + entitySet.getEntityTypeName() + " of set " + entitySet.getName() + " is not declared"));
    }
}
