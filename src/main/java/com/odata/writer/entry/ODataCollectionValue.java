package com.odata.writer.entry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Ordered collection value. Items keep the order they were supplied in and may be null.
 */
@Value
public class ODataCollectionValue {
    @NonNull
    String typeName;

    @NonNull
    List<Object> items;

    public ODataCollectionValue(String typeName, List<?> items) {
        this.typeName = typeName;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }
}
