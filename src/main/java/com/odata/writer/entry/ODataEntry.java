package com.odata.writer.entry;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Structured representation of one entity request body: the entity type name, the
 * properties in input order, and the navigation links in input order.
 */
@Value
@Builder
public class ODataEntry {
    @NonNull
    String typeName;

    @Singular
    List<ODataProperty> properties;

    @Singular
    List<ODataNavigationLink> links;

    public Optional<ODataProperty> findProperty(String name) {
        return properties.stream().filter(p -> p.getName().equals(name)).findFirst();
    }
}
