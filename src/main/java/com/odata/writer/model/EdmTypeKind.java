package com.odata.writer.model;

/**
 * Kind of a type reference used by a declared property.
 */
public enum EdmTypeKind {
    PRIMITIVE,
    ENTITY,
    COMPLEX,
    COLLECTION,
    ENUM,
    UNTYPED
}
