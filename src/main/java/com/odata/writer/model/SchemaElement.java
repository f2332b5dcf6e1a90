package com.odata.writer.model;

/**
 * Any named element declared in a schema namespace.
 */
public interface SchemaElement {

    String getNamespace();

    String getName();

    SchemaElementKind getSchemaElementKind();

    default String getFullName() {
        return getNamespace() + "." + getName();
    }
}
