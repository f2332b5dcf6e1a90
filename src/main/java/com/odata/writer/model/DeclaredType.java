package com.odata.writer.model;

/**
 * A type declared in a schema: entity, complex or enum type.
 */
public interface DeclaredType extends SchemaElement {

    EdmTypeKind getTypeKind();

    @Override
    default SchemaElementKind getSchemaElementKind() {
        return SchemaElementKind.TYPE_DEFINITION;
    }
}
