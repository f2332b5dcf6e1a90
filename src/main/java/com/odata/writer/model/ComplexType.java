package com.odata.writer.model;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.ToString;

/**
 * A keyless structured type used for nested record values.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class ComplexType extends StructuredType {

    @Builder
    public ComplexType(String namespace, String name, String baseTypeName,
                       boolean abstractType, boolean openType,
                       @Singular("property") List<StructuralProperty> structuralProperties) {
        super(namespace, name, baseTypeName, abstractType, openType, structuralProperties);
    }

    @Override
    public EdmTypeKind getTypeKind() {
        return EdmTypeKind.COMPLEX;
    }

    public static class ComplexTypeBuilder {

        public ComplexTypeBuilder property(String propertyName, EdmTypeReference type) {
            return property(StructuralProperty.builder().name(propertyName).type(type).build());
        }
    }
}
