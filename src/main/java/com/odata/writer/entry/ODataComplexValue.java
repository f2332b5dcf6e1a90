package com.odata.writer.entry;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Nested record value, tagged with the qualified name of its complex type.
 */
@Value
public class ODataComplexValue {
    @NonNull
    String typeName;

    @NonNull
    List<ODataProperty> properties;

    public ODataComplexValue(String typeName, List<ODataProperty> properties) {
        this.typeName = typeName;
        this.properties = List.copyOf(properties);
    }
}
