package com.odata.writer.entry;

import lombok.NonNull;
import lombok.Value;

/**
 * A named value in an encoded entry. The value is a coerced primitive, an
 * {@link ODataComplexValue}, an {@link ODataCollectionValue}, or null.
 *
 * {@code typeName} is the declared type of the property, e.g. {@code Edm.Byte}, or null
 * for dynamic properties of open types.
 */
@Value
public class ODataProperty {
    @NonNull
    String name;

    Object value;

    String typeName;

    public ODataProperty(String name, Object value) {
        this(name, value, null);
    }

    public ODataProperty(@NonNull String name, Object value, String typeName) {
        this.name = name;
        this.value = value;
        this.typeName = typeName;
    }
}
