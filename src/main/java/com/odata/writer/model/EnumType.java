package com.odata.writer.model;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class EnumType implements DeclaredType {
    @NonNull
    String namespace;

    @NonNull
    String name;

    @Builder.Default
    EdmPrimitiveKind underlyingType = EdmPrimitiveKind.INT32;

    boolean flags;

    /**
     * Member name to numeric value, in declaration order.
     */
    @Singular
    Map<String, Long> members;

    @Override
    public EdmTypeKind getTypeKind() {
        return EdmTypeKind.ENUM;
    }
}
