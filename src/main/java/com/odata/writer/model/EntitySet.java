package com.odata.writer.model;

import lombok.NonNull;
import lombok.Value;

/**
 * An addressable collection of entities of one entity type.
 */
@Value
public class EntitySet {
    @NonNull
    String name;

    /**
     * Qualified name of the element entity type.
     */
    @NonNull
    String entityTypeName;

    /**
     * Unqualified element type name.
     */
    public String getEntityTypeSimpleName() {
        int dot = entityTypeName.lastIndexOf('.');
        return dot < 0 ? entityTypeName : entityTypeName.substring(dot + 1);
    }
}
