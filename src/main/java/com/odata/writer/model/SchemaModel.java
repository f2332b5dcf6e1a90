package com.odata.writer.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only view of a service schema: declared types, operations and the entity container.
 *
 * Implementations are immutable. Overlays (see
 * {@link com.odata.writer.encoding.DeltaSchemaModel}) forward every lookup they do not
 * answer themselves to their source model.
 */
public interface SchemaModel {

    Optional<DeclaredType> findDeclaredType(String qualifiedName);

    List<EdmOperation> findDeclaredOperations(String qualifiedName);

    List<EdmOperation> findDeclaredBoundOperations(String bindingTypeName);

    List<EdmOperation> findDeclaredBoundOperations(String qualifiedName, String bindingTypeName);

    List<StructuredType> findDirectlyDerivedTypes(String baseTypeName);

    List<SchemaElement> getSchemaElements();

    List<String> getDeclaredNamespaces();

    Optional<EntityContainer> getEntityContainer();

    List<SchemaModel> getReferencedModels();

    default Optional<EntityType> findEntityType(String qualifiedName) {
        return findDeclaredType(qualifiedName)
                .filter(EntityType.class::isInstance)
                .map(EntityType.class::cast);
    }

    default Optional<StructuredType> findStructuredType(String qualifiedName) {
        return findDeclaredType(qualifiedName)
                .filter(StructuredType.class::isInstance)
                .map(StructuredType.class::cast);
    }

    /**
     * All entity sets of every entity container among the schema elements.
     */
    default Stream<EntitySet> entitySets() {
        return getSchemaElements().stream()
                .filter(e -> e.getSchemaElementKind() == SchemaElementKind.ENTITY_CONTAINER)
                .map(EntityContainer.class::cast)
                .flatMap(c -> c.getEntitySets().stream());
    }

    /**
     * The navigation property on the target type that points back along this one.
     */
    default Optional<NavigationProperty> findPartner(NavigationProperty navigation) {
        if (!navigation.hasPartner()) {
            return Optional.empty();
        }
        return findEntityType(navigation.getTargetTypeName())
                .flatMap(target -> target.findNavigationProperty(navigation.getPartnerName()));
    }
}
