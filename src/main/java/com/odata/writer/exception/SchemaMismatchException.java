package com.odata.writer.exception;

/**
 * A supplied property or link name has no matching declaration on the type being written.
 */
public class SchemaMismatchException extends RequestWriterException {

    private static final long serialVersionUID = 1L;

    private final String typeName;
    private final String memberName;

    public SchemaMismatchException(String typeName, String memberName) {
        super("No property or navigation property matching '" + memberName + "' is declared on type " + typeName);
        this.typeName = typeName;
        this.memberName = memberName;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getMemberName() {
        return memberName;
    }
}
