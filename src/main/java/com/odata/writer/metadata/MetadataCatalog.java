package com.odata.writer.metadata;

import java.util.Map;

import com.odata.writer.model.EntitySet;
import com.odata.writer.model.SchemaModel;
import com.odata.writer.util.Pluralizer;

/**
 * Lookup service over a service schema, answering the name-resolution questions the
 * request writer asks. Names supplied by callers are matched case-, separator- and
 * pluralization-insensitively.
 */
public interface MetadataCatalog {

    SchemaModel getModel();

    Pluralizer getPluralizer();

    /**
     * The entity set a caller-supplied collection name refers to.
     *
     * @throws com.odata.writer.exception.MetadataException if no entity set matches
     */
    EntitySet getConcreteEntityCollection(String collectionName);

    String getEntitySetTypeNamespace(String collectionName);

    String getEntitySetTypeName(String collectionName);

    boolean entitySetTypeRequiresOptimisticConcurrencyCheck(String collectionName);

    /**
     * Split entry data into structural properties and navigation links.
     * Many-valued link data (a collection of maps) becomes one link per element.
     */
    EntryDetails parseEntryDetails(String collectionName, Map<String, ?> entryData, Integer contentId);

    /**
     * Format key values as a URI key segment, e.g. {@code (3)} or {@code (OrderID=1,ProductID=7)}.
     */
    String convertKeyToUriLiteral(Map<String, ?> keyValues);

    boolean namesAreEqual(String actualName, String requestedName);
}
