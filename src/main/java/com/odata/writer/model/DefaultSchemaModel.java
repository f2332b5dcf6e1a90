package com.odata.writer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;

/**
 * Immutable in-memory schema, typically produced by
 * {@link com.odata.writer.metadata.CsdlMetadataReader}.
 */
public final class DefaultSchemaModel implements SchemaModel {

    private final List<SchemaElement> schemaElements;
    private final Map<String, DeclaredType> typesByName;
    private final List<String> declaredNamespaces;
    private final List<SchemaModel> referencedModels;

    @Builder
    private DefaultSchemaModel(@Singular("element") List<SchemaElement> schemaElements,
                               @Singular("reference") List<SchemaModel> referencedModels) {
        this.schemaElements = List.copyOf(schemaElements);
        this.referencedModels = List.copyOf(referencedModels);

        Map<String, DeclaredType> types = new LinkedHashMap<>();
        LinkedHashSet<String> namespaces = new LinkedHashSet<>();
        for (SchemaElement element : schemaElements) {
            namespaces.add(element.getNamespace());
            if (element instanceof DeclaredType type) {
                types.put(type.getFullName(), type);
            }
        }
        this.typesByName = Collections.unmodifiableMap(types);
        this.declaredNamespaces = List.copyOf(namespaces);
    }

    @Override
    public Optional<DeclaredType> findDeclaredType(String qualifiedName) {
        DeclaredType type = typesByName.get(qualifiedName);
        if (type != null) {
            return Optional.of(type);
        }
        for (SchemaModel referenced : referencedModels) {
            Optional<DeclaredType> found = referenced.findDeclaredType(qualifiedName);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    @Override
    public List<EdmOperation> findDeclaredOperations(String qualifiedName) {
        return operations().stream()
                .filter(op -> op.getFullName().equals(qualifiedName))
                .toList();
    }

    @Override
    public List<EdmOperation> findDeclaredBoundOperations(String bindingTypeName) {
        return operations().stream()
                .filter(op -> Objects.equals(op.getBindingTypeName(), bindingTypeName))
                .toList();
    }

    @Override
    public List<EdmOperation> findDeclaredBoundOperations(String qualifiedName, String bindingTypeName) {
        return findDeclaredBoundOperations(bindingTypeName).stream()
                .filter(op -> op.getFullName().equals(qualifiedName))
                .toList();
    }

    @Override
    public List<StructuredType> findDirectlyDerivedTypes(String baseTypeName) {
        return typesByName.values().stream()
                .filter(StructuredType.class::isInstance)
                .map(StructuredType.class::cast)
                .filter(t -> Objects.equals(t.getBaseTypeName(), baseTypeName))
                .toList();
    }

    @Override
    public List<SchemaElement> getSchemaElements() {
        return schemaElements;
    }

    @Override
    public List<String> getDeclaredNamespaces() {
        return declaredNamespaces;
    }

    @Override
    public Optional<EntityContainer> getEntityContainer() {
        return schemaElements.stream()
                .filter(EntityContainer.class::isInstance)
                .map(EntityContainer.class::cast)
                .findFirst();
    }

    @Override
    public List<SchemaModel> getReferencedModels() {
        return referencedModels;
    }

    private List<EdmOperation> operations() {
        return schemaElements.stream()
                .filter(EdmOperation.class::isInstance)
                .map(EdmOperation.class::cast)
                .toList();
    }
}
