package com.odata.writer.format;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odata.writer.entry.ODataCollectionValue;
import com.odata.writer.entry.ODataComplexValue;
import com.odata.writer.entry.ODataEntry;
import com.odata.writer.entry.ODataNavigationLink;
import com.odata.writer.entry.ODataProperty;
import com.odata.writer.model.Multiplicity;
import com.odata.writer.spatial.SpatialValue;

/**
 * OData v4 JSON payloads with minimal metadata.
 *
 * Entries carry {@code @odata.type}; links are written as {@code Name@odata.bind}, as an
 * array when the navigation property is many-valued.
 */
public class JsonPayloadSerializer implements PayloadSerializer {

    static final String ODATA_TYPE = "@odata.type";
    static final String ODATA_BIND = "@odata.bind";
    static final String ODATA_ID = "@odata.id";
    static final String ODATA_CONTEXT = "@odata.context";

    private final ObjectMapper mapper = new ObjectMapper();
    private final String urlBase;
    private final boolean indent;

    public JsonPayloadSerializer(String urlBase, boolean indent) {
        this.urlBase = urlBase;
        this.indent = indent;
    }

    @Override
    public PayloadFormat getFormat() {
        return PayloadFormat.JSON;
    }

    @Override
    public void writeEntry(ODataEntry entry, OutputStream out) throws IOException {
        try (JsonGenerator gen = createGenerator(out)) {
            gen.writeStartObject();
            gen.writeStringField(ODATA_TYPE, "#" + entry.getTypeName());
            for (ODataProperty property : entry.getProperties()) {
                gen.writeFieldName(property.getName());
                writeValue(gen, property.getValue());
            }
            writeLinks(gen, entry.getLinks());
            gen.writeEndObject();
        }
    }

    @Override
    public void writeReferenceLink(String linkPath, OutputStream out) throws IOException {
        try (JsonGenerator gen = createGenerator(out)) {
            gen.writeStartObject();
            if (urlBase != null && !urlBase.isEmpty()) {
                gen.writeStringField(ODATA_CONTEXT, (urlBase.endsWith("/") ? urlBase : urlBase + "/") + "$metadata#$ref");
            }
            gen.writeStringField(ODATA_ID, linkPath);
            gen.writeEndObject();
        }
    }

    private JsonGenerator createGenerator(OutputStream out) throws IOException {
        JsonGenerator gen = mapper.getFactory().createGenerator(out, JsonEncoding.UTF8);
        gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (indent) {
            gen.useDefaultPrettyPrinter();
        }
        return gen;
    }

    private void writeLinks(JsonGenerator gen, List<ODataNavigationLink> links) throws IOException {
        // several links may share one navigation property
        Map<String, List<ODataNavigationLink>> byName = new LinkedHashMap<>();
        for (ODataNavigationLink link : links) {
            byName.computeIfAbsent(link.getName(), k -> new ArrayList<>()).add(link);
        }

        for (Map.Entry<String, List<ODataNavigationLink>> group : byName.entrySet()) {
            List<ODataNavigationLink> targets = group.getValue();
            gen.writeFieldName(group.getKey() + ODATA_BIND);
            boolean many = targets.size() > 1 || targets.get(0).getTargetMultiplicity() == Multiplicity.MANY;
            if (many) {
                gen.writeStartArray();
                for (ODataNavigationLink link : targets) {
                    gen.writeString(link.getReference().toUri());
                }
                gen.writeEndArray();
            } else {
                gen.writeString(targets.get(0).getReference().toUri());
            }
        }
    }

    private void writeValue(JsonGenerator gen, Object value) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof ODataComplexValue complex) {
            gen.writeStartObject();
            gen.writeStringField(ODATA_TYPE, "#" + complex.getTypeName());
            for (ODataProperty property : complex.getProperties()) {
                gen.writeFieldName(property.getName());
                writeValue(gen, property.getValue());
            }
            gen.writeEndObject();
        } else if (value instanceof ODataCollectionValue collection) {
            writeArray(gen, collection.getItems());
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof BigDecimal d) {
            gen.writeNumber(d);
        } else if (value instanceof BigInteger i) {
            gen.writeNumber(i);
        } else if (value instanceof Double || value instanceof Float) {
            writeFloatingPoint(gen, ((Number) value).doubleValue(), value instanceof Float);
        } else if (value instanceof Number n) {
            gen.writeNumber(n.longValue());
        } else if (value instanceof byte[] bytes) {
            gen.writeBinary(bytes);
        } else if (value instanceof InputStream stream) {
            gen.writeBinary(stream.readAllBytes());
        } else if (value instanceof SpatialValue spatial) {
            writeValue(gen, spatial.toGeoJson());
        } else if (value instanceof Map<?, ?> map) {
            gen.writeStartObject();
            for (Map.Entry<?, ?> item : map.entrySet()) {
                gen.writeFieldName(String.valueOf(item.getKey()));
                writeValue(gen, item.getValue());
            }
            gen.writeEndObject();
        } else if (value instanceof Iterable<?> items) {
            writeArray(gen, items);
        } else if (value instanceof char[] chars) {
            gen.writeString(new String(chars));
        } else if (value instanceof Enum<?> e) {
            gen.writeString(e.name());
        } else {
            // temporal values, durations and guids in their ISO / canonical text form
            gen.writeString(value.toString());
        }
    }

    private void writeArray(JsonGenerator gen, Iterable<?> items) throws IOException {
        gen.writeStartArray();
        for (Object item : items) {
            writeValue(gen, item);
        }
        gen.writeEndArray();
    }

    private static void writeFloatingPoint(JsonGenerator gen, double d, boolean single) throws IOException {
        if (Double.isNaN(d)) {
            gen.writeString("NaN");
        } else if (Double.isInfinite(d)) {
            gen.writeString(d > 0 ? "INF" : "-INF");
        } else if (single) {
            gen.writeNumber((float) d);
        } else {
            gen.writeNumber(d);
        }
    }
}
