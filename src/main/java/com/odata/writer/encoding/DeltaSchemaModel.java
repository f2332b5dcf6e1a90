package com.odata.writer.encoding;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.odata.writer.model.DeclaredType;
import com.odata.writer.model.EdmOperation;
import com.odata.writer.model.EdmTypeReference;
import com.odata.writer.model.EntityContainer;
import com.odata.writer.model.EntityType;
import com.odata.writer.model.NavigationProperty;
import com.odata.writer.model.SchemaElement;
import com.odata.writer.model.SchemaModel;
import com.odata.writer.model.StructuralProperty;
import com.odata.writer.model.StructuredType;
import com.odata.writer.util.NamingUtil;
import com.odata.writer.util.Pluralizer;

/**
 * Schema overlay used for partial (PATCH) updates.
 *
 * Declares a copy of one entity type, under the same qualified name, that keeps only the
 * properties named by the caller; navigation properties are re-declared one-directional.
 * Every other lookup is answered by the source model.
 *
 * Created per write and never shared.
 */
public final class DeltaSchemaModel implements SchemaModel {

    private final SchemaModel source;
    private final EntityType entityType;

    public DeltaSchemaModel(SchemaModel source, EntityType entityType, Collection<String> propertyNames) {
        this(source, entityType, propertyNames, null);
    }

    public DeltaSchemaModel(SchemaModel source, EntityType entityType, Collection<String> propertyNames,
                            Pluralizer pluralizer) {
        this.source = Objects.requireNonNull(source, "source");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(propertyNames, "propertyNames");

        EntityType.EntityTypeBuilder restricted = EntityType.builder()
                .namespace(entityType.getNamespace())
                .name(entityType.getName())
                .baseTypeName(entityType.getBaseTypeName())
                .abstractType(entityType.isAbstractType())
                .openType(entityType.isOpenType())
                .hasStream(entityType.isHasStream());

        for (StructuralProperty property : entityType.getStructuralProperties()) {
            if (isKept(property.getName(), propertyNames, pluralizer)) {
                restricted.property(StructuralProperty.builder()
                        .name(property.getName())
                        .type(property.getType())
                        .defaultValue(property.getDefaultValue())
                        .concurrencyMode(property.getConcurrencyMode())
                        .build());
            }
        }

        for (String keyName : entityType.getDeclaredKey()) {
            if (isKept(keyName, propertyNames, pluralizer)) {
                restricted.key(keyName);
            }
        }

        for (NavigationProperty property : entityType.getNavigationProperties()) {
            if (isKept(property.getName(), propertyNames, pluralizer)) {
                restricted.navigation(unidirectional(source, property));
            }
        }

        this.entityType = restricted.build();
    }

    /**
     * The restricted entity type this overlay declares.
     */
    public EntityType getEntityType() {
        return entityType;
    }

    public SchemaModel getSource() {
        return source;
    }

    @Override
    public Optional<DeclaredType> findDeclaredType(String qualifiedName) {
        if (entityType.getFullName().equals(qualifiedName)) {
            return Optional.of(entityType);
        }
        return source.findDeclaredType(qualifiedName);
    }

    @Override
    public List<EdmOperation> findDeclaredOperations(String qualifiedName) {
        return source.findDeclaredOperations(qualifiedName);
    }

    @Override
    public List<EdmOperation> findDeclaredBoundOperations(String bindingTypeName) {
        return source.findDeclaredBoundOperations(bindingTypeName);
    }

    @Override
    public List<EdmOperation> findDeclaredBoundOperations(String qualifiedName, String bindingTypeName) {
        return source.findDeclaredBoundOperations(qualifiedName, bindingTypeName);
    }

    @Override
    public List<StructuredType> findDirectlyDerivedTypes(String baseTypeName) {
        return source.findDirectlyDerivedTypes(baseTypeName);
    }

    @Override
    public List<SchemaElement> getSchemaElements() {
        return source.getSchemaElements();
    }

    @Override
    public List<String> getDeclaredNamespaces() {
        return source.getDeclaredNamespaces();
    }

    @Override
    public Optional<EntityContainer> getEntityContainer() {
        return source.getEntityContainer();
    }

    @Override
    public List<SchemaModel> getReferencedModels() {
        return source.getReferencedModels();
    }

    private static boolean isKept(String propertyName, Collection<String> propertyNames, Pluralizer pluralizer) {
        return propertyNames.stream().anyMatch(name -> NamingUtil.namesAreEqual(propertyName, name, pluralizer));
    }

    /**
     * Copy of a navigation property without back-navigation. The target is the partner's
     * declaring type when a partner is declared.
     */
    private static NavigationProperty unidirectional(SchemaModel source, NavigationProperty property) {
        String targetTypeName = source.findPartner(property)
                .map(NavigationProperty::getDeclaringTypeName)
                .orElse(property.getTargetTypeName());

        EdmTypeReference target = property.getType().isCollection()
                ? EdmTypeReference.collectionOf(
                        property.getType().unwrapCollection().toBuilder().fullName(targetTypeName).build())
                : property.getType().toBuilder().fullName(targetTypeName).build();

        return NavigationProperty.builder()
                .name(property.getName())
                .type(target)
                .declaringTypeName(property.getDeclaringTypeName())
                .partnerName(null)
                .containsTarget(property.isContainsTarget())
                .dependentProperties(property.getDependentProperties())
                .onDelete(property.getOnDelete())
                .build();
    }
}
