package com.odata.writer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Reference to a type from a property declaration.
 *
 * Structured and enum types are referenced by qualified name only; the definition
 * is looked up through the {@link SchemaModel} that is active for the write.
 */
@Value
@Builder(toBuilder = true)
public class EdmTypeReference {

    private static final String COLLECTION_PREFIX = "Collection(";

    @NonNull
    EdmTypeKind kind;

    /**
     * Qualified type name, e.g. {@code Edm.String}, {@code Sales.Address},
     * {@code Collection(Edm.String)}.
     */
    @NonNull
    String fullName;

    /**
     * Set for {@link EdmTypeKind#PRIMITIVE} references.
     */
    EdmPrimitiveKind primitiveKind;

    /**
     * Element type for {@link EdmTypeKind#COLLECTION} references.
     */
    EdmTypeReference elementType;

    @Builder.Default
    boolean nullable = true;

    public boolean isCollection() {
        return kind == EdmTypeKind.COLLECTION;
    }

    public boolean isStructured() {
        return kind == EdmTypeKind.ENTITY || kind == EdmTypeKind.COMPLEX;
    }

    /**
     * The element type for a collection, this reference otherwise.
     */
    public EdmTypeReference unwrapCollection() {
        return isCollection() && elementType != null ? elementType : this;
    }

    public static EdmTypeReference primitive(EdmPrimitiveKind kind, boolean nullable) {
        return EdmTypeReference.builder()
                .kind(EdmTypeKind.PRIMITIVE)
                .fullName(kind.getEdmName())
                .primitiveKind(kind)
                .nullable(nullable)
                .build();
    }

    public static EdmTypeReference complex(String qualifiedName, boolean nullable) {
        return EdmTypeReference.builder()
                .kind(EdmTypeKind.COMPLEX)
                .fullName(qualifiedName)
                .nullable(nullable)
                .build();
    }

    public static EdmTypeReference entity(String qualifiedName, boolean nullable) {
        return EdmTypeReference.builder()
                .kind(EdmTypeKind.ENTITY)
                .fullName(qualifiedName)
                .nullable(nullable)
                .build();
    }

    public static EdmTypeReference enumeration(String qualifiedName, boolean nullable) {
        return EdmTypeReference.builder()
                .kind(EdmTypeKind.ENUM)
                .fullName(qualifiedName)
                .nullable(nullable)
                .build();
    }

    public static EdmTypeReference collectionOf(EdmTypeReference element) {
        return EdmTypeReference.builder()
                .kind(EdmTypeKind.COLLECTION)
                .fullName(COLLECTION_PREFIX + element.getFullName() + ")")
                .elementType(element)
                .nullable(true)
                .build();
    }

    public static boolean isCollectionName(String typeName) {
        return typeName != null && typeName.startsWith(COLLECTION_PREFIX) && typeName.endsWith(")");
    }

    public static String elementTypeName(String collectionTypeName) {
        return collectionTypeName.substring(COLLECTION_PREFIX.length(), collectionTypeName.length() - 1);
    }
}
