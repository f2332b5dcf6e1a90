package com.odata.writer.model;

public enum SchemaElementKind {
    TYPE_DEFINITION,
    ACTION,
    FUNCTION,
    ENTITY_CONTAINER
}
