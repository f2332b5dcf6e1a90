package com.odata.writer.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A declared action or function.
 *
 * For bound operations the first parameter is the binding parameter.
 */
@Value
@Builder
public class EdmOperation implements SchemaElement {
    @NonNull
    String namespace;

    @NonNull
    String name;

    @NonNull
    SchemaElementKind schemaElementKind;

    boolean bound;

    /**
     * Parameter type names in declaration order.
     */
    @Singular
    List<String> parameterTypes;

    String returnType;

    public String getBindingTypeName() {
        return bound && !parameterTypes.isEmpty() ? parameterTypes.get(0) : null;
    }
}
