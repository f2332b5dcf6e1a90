package com.odata.writer.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * A keyed structured type with navigation properties.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class EntityType extends StructuredType {
    private final List<String> declaredKey;
    private final List<NavigationProperty> navigationProperties;
    private final boolean hasStream;

    @Builder
    public EntityType(String namespace, String name, String baseTypeName,
                      boolean abstractType, boolean openType, boolean hasStream,
                      @Singular("key") List<String> declaredKey,
                      @Singular("property") List<StructuralProperty> structuralProperties,
                      @Singular("navigation") List<NavigationProperty> navigationProperties) {
        super(namespace, name, baseTypeName, abstractType, openType, structuralProperties);
        this.hasStream = hasStream;
        this.declaredKey = declaredKey != null ? List.copyOf(declaredKey) : List.of();
        this.navigationProperties = navigationProperties != null ? List.copyOf(navigationProperties) : List.of();
    }

    @Override
    public EdmTypeKind getTypeKind() {
        return EdmTypeKind.ENTITY;
    }

    public Optional<NavigationProperty> findNavigationProperty(String propertyName) {
        return navigationProperties.stream()
                .filter(p -> p.getName().equals(propertyName))
                .findFirst();
    }

    /**
     * Whether any declared property carries {@code ConcurrencyMode="Fixed"}.
     */
    public boolean hasConcurrencyTokens() {
        return structuralProperties.stream().anyMatch(StructuralProperty::isConcurrencyToken);
    }

    public static class EntityTypeBuilder {

        public EntityTypeBuilder property(String propertyName, EdmTypeReference type) {
            return property(StructuralProperty.builder().name(propertyName).type(type).build());
        }
    }
}
