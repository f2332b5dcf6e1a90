package com.odata.writer.format;

import java.io.IOException;
import java.io.OutputStream;

import com.odata.writer.entry.ODataEntry;

/**
 * Renders encoded entries as request bodies. Implementations leave the target stream open.
 */
public interface PayloadSerializer {

    PayloadFormat getFormat();

    void writeEntry(ODataEntry entry, OutputStream out) throws IOException;

    /**
     * Write the body of a standalone entity reference link request.
     *
     * @param linkPath URI of the referenced entity, e.g. {@code Employees(3)}
     */
    void writeReferenceLink(String linkPath, OutputStream out) throws IOException;

    default String getContentType() {
        return getFormat().getContentType();
    }
}
