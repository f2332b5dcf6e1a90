package com.odata.writer.format;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.odata.writer.coercion.TypeCoercionTable;
import com.odata.writer.entry.ODataCollectionValue;
import com.odata.writer.entry.ODataComplexValue;
import com.odata.writer.entry.ODataEntry;
import com.odata.writer.entry.ODataNavigationLink;
import com.odata.writer.entry.ODataProperty;
import com.odata.writer.exception.RequestWriterException;
import com.odata.writer.model.EdmPrimitiveKind;
import com.odata.writer.model.EdmTypeReference;
import com.odata.writer.spatial.SpatialValue;

import freemarker.core.XMLOutputFormat;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Atom XML payloads rendered from FreeMarker templates.
 *
 * The encoded entry is flattened into a view model of plain maps: one node per property,
 * with nested nodes for complex values and collection elements.
 */
public class AtomPayloadSerializer implements PayloadSerializer {

    private static final String ENTRY_TEMPLATE = "atom-entry.ftl";
    private static final String REF_TEMPLATE = "atom-ref.ftl";
    private static final String EDM_PREFIX = "Edm.";

    private final Configuration freemarkerConfig;
    private final String urlBase;
    private final Clock clock;

    public AtomPayloadSerializer(String urlBase) {
        this(urlBase, Clock.systemUTC());
    }

    AtomPayloadSerializer(String urlBase, Clock clock) {
        this.urlBase = urlBase;
        this.clock = clock;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setOutputFormat(XMLOutputFormat.INSTANCE);
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    @Override
    public PayloadFormat getFormat() {
        return PayloadFormat.ATOM;
    }

    @Override
    public void writeEntry(ODataEntry entry, OutputStream out) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("baseUri", urlBase == null ? "" : urlBase);
        model.put("updated", OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.SECONDS).toString());
        model.put("typeName", entry.getTypeName());
        model.put("links", linkNodes(entry.getLinks()));

        List<Map<String, Object>> properties = new ArrayList<>();
        for (ODataProperty property : entry.getProperties()) {
            properties.add(valueNode("d:" + property.getName(), property.getValue(), property.getTypeName()));
        }
        model.put("properties", properties);

        render(ENTRY_TEMPLATE, model, out);
    }

    @Override
    public void writeReferenceLink(String linkPath, OutputStream out) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("id", linkPath);
        model.put("context", urlBase == null || urlBase.isEmpty()
                ? ""
                : (urlBase.endsWith("/") ? urlBase : urlBase + "/") + "$metadata#$ref");
        render(REF_TEMPLATE, model, out);
    }

    private void render(String templateName, Map<String, Object> model, OutputStream out) throws IOException {
        Template template = freemarkerConfig.getTemplate(templateName);
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        try {
            template.process(model, writer);
        } catch (TemplateException e) {
            throw new RequestWriterException("Failed to render " + templateName, e);
        }
        writer.flush();
    }

    private static List<Map<String, Object>> linkNodes(List<ODataNavigationLink> links) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (ODataNavigationLink link : links) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("name", link.getName());
            node.put("relation", link.getRelation());
            node.put("linkType", link.isCollection() ? "feed" : "entry");
            node.put("href", link.getReference().toUri());
            nodes.add(node);
        }
        return nodes;
    }

    private static Map<String, Object> valueNode(String tag, Object value, String declaredTypeName)
            throws IOException {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("tag", tag);
        node.put("isNull", value == null);
        node.put("typeName", "");
        node.put("text", "");
        node.put("children", List.of());

        if (value instanceof ODataComplexValue complex) {
            List<Map<String, Object>> children = new ArrayList<>();
            for (ODataProperty property : complex.getProperties()) {
                children.add(valueNode("d:" + property.getName(), property.getValue(), property.getTypeName()));
            }
            node.put("kind", "structured");
            node.put("typeName", complex.getTypeName());
            node.put("children", children);
        } else if (value instanceof ODataCollectionValue collection) {
            List<Map<String, Object>> children = new ArrayList<>();
            String elementTypeName = EdmTypeReference.isCollectionName(collection.getTypeName())
                    ? EdmTypeReference.elementTypeName(collection.getTypeName())
                    : null;
            for (Object item : collection.getItems()) {
                children.add(valueNode("m:element", item, elementTypeName));
            }
            node.put("kind", "structured");
            node.put("typeName", collection.getTypeName());
            node.put("children", children);
        } else {
            node.put("kind", "primitive");
            if (value != null) {
                node.put("typeName", primitiveTypeName(value, declaredTypeName));
                node.put("text", formatText(value));
            }
        }
        return node;
    }

    /**
     * {@code m:type} attribute for a primitive value; strings are untyped. The declared
     * type, when known, wins over the value's class.
     */
    private static String primitiveTypeName(Object value, String declaredTypeName) {
        if (declaredTypeName != null && declaredTypeName.startsWith(EDM_PREFIX)) {
            return EdmPrimitiveKind.STRING.getEdmName().equals(declaredTypeName) ? "" : declaredTypeName;
        }
        return TypeCoercionTable.resolve(value.getClass())
                .filter(kind -> kind != EdmPrimitiveKind.STRING)
                .map(EdmPrimitiveKind::getEdmName)
                .orElse("");
    }

    private static String formatText(Object value) throws IOException {
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "INF" : "-INF";
            }
            return value.toString();
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof InputStream stream) {
            return Base64.getEncoder().encodeToString(stream.readAllBytes());
        }
        if (value instanceof SpatialValue spatial) {
            return spatial.toWellKnownText();
        }
        if (value instanceof char[] chars) {
            return new String(chars);
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return value.toString();
    }
}
