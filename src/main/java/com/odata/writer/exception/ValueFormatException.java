package com.odata.writer.exception;

import com.odata.writer.model.EdmPrimitiveKind;

public class ValueFormatException extends RequestWriterException {

    private static final long serialVersionUID = 1L;

    private final transient Class<?> sourceType;
    private final EdmPrimitiveKind targetKind;

    public ValueFormatException(Class<?> sourceType, EdmPrimitiveKind targetKind) {
        super(String.format("Unable to convert value of type %s to OData type %s",
                sourceType.getName(), targetKind.getEdmName()));
        this.sourceType = sourceType;
        this.targetKind = targetKind;
    }

    public Class<?> getSourceType() {
        return sourceType;
    }

    public EdmPrimitiveKind getTargetKind() {
        return targetKind;
    }
}
