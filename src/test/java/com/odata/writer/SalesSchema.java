package com.odata.writer;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import com.odata.writer.metadata.CsdlMetadataReader;
import com.odata.writer.metadata.DefaultMetadataCatalog;
import com.odata.writer.metadata.MetadataCatalog;
import com.odata.writer.model.SchemaModel;
import com.odata.writer.util.SimplePluralizer;

/**
 * Loads the {@code Sales} test schema from {@code /metadata/sales.xml}.
 */
public final class SalesSchema {

    public static final String RESOURCE = "/metadata/sales.xml";

    private SalesSchema() {
    }

    public static SchemaModel model() {
        try (InputStream in = SalesSchema.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing test resource " + RESOURCE);
            }
            return CsdlMetadataReader.read(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static MetadataCatalog catalog() {
        return new DefaultMetadataCatalog(model(), new SimplePluralizer());
    }
}
