package com.odata.writer.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Base class for entity and complex types: an ordered set of structural properties
 * under a qualified name.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class StructuredType implements DeclaredType {
    protected final String namespace;
    protected final String name;
    protected final String baseTypeName;
    protected final boolean abstractType;
    protected final boolean openType;
    protected final List<StructuralProperty> structuralProperties;

    protected StructuredType(String namespace, String name, String baseTypeName,
                             boolean abstractType, boolean openType,
                             List<StructuralProperty> structuralProperties) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.name = Objects.requireNonNull(name, "name");
        this.baseTypeName = baseTypeName;
        this.abstractType = abstractType;
        this.openType = openType;
        this.structuralProperties = structuralProperties != null ? List.copyOf(structuralProperties) : List.of();
    }

    /**
     * Exact (case-sensitive) lookup of a declared structural property.
     */
    public Optional<StructuralProperty> findProperty(String propertyName) {
        return structuralProperties.stream()
                .filter(p -> p.getName().equals(propertyName))
                .findFirst();
    }
}
