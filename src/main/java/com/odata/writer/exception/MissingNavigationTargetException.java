package com.odata.writer.exception;

/**
 * No entity set exposes the target type of a navigation link, so the link cannot be addressed.
 */
public class MissingNavigationTargetException extends RequestWriterException {

    private static final long serialVersionUID = 1L;

    public MissingNavigationTargetException(String linkName, String targetTypeName) {
        super("No entity set found for type " + targetTypeName + " referenced by link '" + linkName + "'");
    }
}
