package com.odata.writer.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class EntityContainer implements SchemaElement {
    @NonNull
    String namespace;

    @NonNull
    String name;

    @Singular
    List<EntitySet> entitySets;

    @Override
    public SchemaElementKind getSchemaElementKind() {
        return SchemaElementKind.ENTITY_CONTAINER;
    }
}
