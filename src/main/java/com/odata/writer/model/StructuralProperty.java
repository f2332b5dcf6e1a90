package com.odata.writer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A declared structural (non-navigation) property of an entity or complex type.
 */
@Value
@Builder(toBuilder = true)
public class StructuralProperty {
    @NonNull
    String name;

    @NonNull
    EdmTypeReference type;

    String defaultValue;

    @Builder.Default
    ConcurrencyMode concurrencyMode = ConcurrencyMode.NONE;

    public boolean isConcurrencyToken() {
        return concurrencyMode == ConcurrencyMode.FIXED;
    }
}
