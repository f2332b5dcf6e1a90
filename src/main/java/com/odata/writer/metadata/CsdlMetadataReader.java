package com.odata.writer.metadata;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odata.writer.exception.MetadataException;
import com.odata.writer.model.ComplexType;
import com.odata.writer.model.ConcurrencyMode;
import com.odata.writer.model.DefaultSchemaModel;
import com.odata.writer.model.EdmOperation;
import com.odata.writer.model.EdmPrimitiveKind;
import com.odata.writer.model.EdmTypeKind;
import com.odata.writer.model.EdmTypeReference;
import com.odata.writer.model.EntityContainer;
import com.odata.writer.model.EntitySet;
import com.odata.writer.model.EntityType;
import com.odata.writer.model.EnumType;
import com.odata.writer.model.NavigationProperty;
import com.odata.writer.model.OnDeleteAction;
import com.odata.writer.model.SchemaElement;
import com.odata.writer.model.SchemaElementKind;
import com.odata.writer.model.SchemaModel;
import com.odata.writer.model.StructuralProperty;

/**
 * Reads a CSDL (OData v4 {@code $metadata}) XML document into a {@link SchemaModel}.
 *
 * Parsing is two-phase: declarations are collected with their type names as written,
 * then type references are resolved once every declared type is known. Derived types
 * carry the properties of their base types, base first.
 */
public class CsdlMetadataReader {
    private static final Logger log = LoggerFactory.getLogger(CsdlMetadataReader.class);

    private final List<Object> declarations = new ArrayList<>();
    private final Map<String, String> aliases = new HashMap<>();
    private final Map<String, RawStructuredType> structuredTypes = new HashMap<>();
    private final Map<String, EdmTypeKind> declaredKinds = new HashMap<>();

    private String schemaNamespace;
    private RawStructuredType currentType;
    private RawNavigation currentNavigation;
    private EnumType.EnumTypeBuilder currentEnum;
    private long nextMemberValue;
    private RawOperation currentOperation;
    private RawContainer currentContainer;

    private CsdlMetadataReader() {
    }

    public static SchemaModel read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static SchemaModel readString(String xml) {
        return read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    public static SchemaModel read(InputStream in) {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        try {
            XMLStreamReader reader = factory.createXMLStreamReader(in);
            try {
                return new CsdlMetadataReader().parse(reader);
            } finally {
                reader.close();
            }
        } catch (XMLStreamException e) {
            throw new MetadataException("Malformed metadata document: " + e.getMessage(), e);
        }
    }

    private SchemaModel parse(XMLStreamReader reader) throws XMLStreamException {
        boolean sawSchema = false;
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                if ("Schema".equals(reader.getLocalName())) {
                    sawSchema = true;
                }
                startElement(reader);
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                endElement(reader.getLocalName());
            }
        }
        if (!sawSchema) {
            throw new MetadataException("Metadata document contains no Schema element");
        }

        SchemaModel model = build();
        log.info("Read metadata: {} schema elements in namespaces {}",
                model.getSchemaElements().size(), model.getDeclaredNamespaces());
        return model;
    }

    private void startElement(XMLStreamReader reader) {
        switch (reader.getLocalName()) {
            case "Schema" -> {
                schemaNamespace = required(reader, "Namespace");
                String alias = attr(reader, "Alias");
                if (alias != null) {
                    aliases.put(alias, schemaNamespace);
                }
            }
            case "EntityType", "ComplexType" -> {
                boolean entity = "EntityType".equals(reader.getLocalName());
                currentType = new RawStructuredType(schemaNamespace, required(reader, "Name"), entity);
                currentType.baseType = attr(reader, "BaseType");
                currentType.abstractType = bool(reader, "Abstract", false);
                currentType.openType = bool(reader, "OpenType", false);
                currentType.hasStream = bool(reader, "HasStream", false);
                String fullName = currentType.fullName();
                structuredTypes.put(fullName, currentType);
                declaredKinds.put(fullName, entity ? EdmTypeKind.ENTITY : EdmTypeKind.COMPLEX);
                declarations.add(currentType);
            }
            case "PropertyRef" -> {
                if (currentType != null) {
                    currentType.key.add(required(reader, "Name"));
                }
            }
            case "Property" -> {
                if (currentType != null) {
                    RawProperty property = new RawProperty();
                    property.name = required(reader, "Name");
                    property.typeName = required(reader, "Type");
                    property.nullable = bool(reader, "Nullable", true);
                    property.defaultValue = attr(reader, "DefaultValue");
                    property.concurrencyMode = "Fixed".equalsIgnoreCase(attr(reader, "ConcurrencyMode"))
                            ? ConcurrencyMode.FIXED : ConcurrencyMode.NONE;
                    currentType.properties.add(property);
                }
            }
            case "NavigationProperty" -> {
                if (currentType != null) {
                    currentNavigation = new RawNavigation();
                    currentNavigation.name = required(reader, "Name");
                    currentNavigation.typeName = required(reader, "Type");
                    currentNavigation.nullable = bool(reader, "Nullable", true);
                    currentNavigation.partner = attr(reader, "Partner");
                    currentNavigation.containsTarget = bool(reader, "ContainsTarget", false);
                    currentType.navigations.add(currentNavigation);
                }
            }
            case "ReferentialConstraint" -> {
                if (currentNavigation != null) {
                    currentNavigation.dependentProperties.add(required(reader, "Property"));
                }
            }
            case "OnDelete" -> {
                if (currentNavigation != null) {
                    currentNavigation.onDelete = OnDeleteAction.fromCsdl(attr(reader, "Action"));
                }
            }
            case "EnumType" -> {
                String name = required(reader, "Name");
                String underlying = attr(reader, "UnderlyingType");
                currentEnum = EnumType.builder()
                        .namespace(schemaNamespace)
                        .name(name)
                        .flags(bool(reader, "IsFlags", false))
                        .underlyingType(underlying == null ? EdmPrimitiveKind.INT32
                                : EdmPrimitiveKind.fromEdmName(underlying).orElse(EdmPrimitiveKind.INT32));
                nextMemberValue = 0;
                declaredKinds.put(schemaNamespace + "." + name, EdmTypeKind.ENUM);
            }
            case "Member" -> {
                if (currentEnum != null) {
                    String value = attr(reader, "Value");
                    long memberValue = value != null ? parseLong(value) : nextMemberValue;
                    currentEnum.member(required(reader, "Name"), memberValue);
                    nextMemberValue = memberValue + 1;
                }
            }
            case "Action", "Function" -> {
                currentOperation = new RawOperation();
                currentOperation.namespace = schemaNamespace;
                currentOperation.name = required(reader, "Name");
                currentOperation.kind = "Action".equals(reader.getLocalName())
                        ? SchemaElementKind.ACTION : SchemaElementKind.FUNCTION;
                currentOperation.bound = bool(reader, "IsBound", false);
                declarations.add(currentOperation);
            }
            case "Parameter" -> {
                if (currentOperation != null) {
                    currentOperation.parameterTypes.add(required(reader, "Type"));
                }
            }
            case "ReturnType" -> {
                if (currentOperation != null) {
                    currentOperation.returnType = required(reader, "Type");
                }
            }
            case "EntityContainer" -> {
                currentContainer = new RawContainer();
                currentContainer.namespace = schemaNamespace;
                currentContainer.name = required(reader, "Name");
                declarations.add(currentContainer);
            }
            case "EntitySet" -> {
                if (currentContainer != null) {
                    currentContainer.entitySets.add(new String[] {
                            required(reader, "Name"), required(reader, "EntityType") });
                }
            }
            default -> {
                // annotations, singletons, imports and terms are not needed for writing
            }
        }
    }

    private void endElement(String localName) {
        switch (localName) {
            case "EntityType", "ComplexType" -> currentType = null;
            case "NavigationProperty" -> currentNavigation = null;
            case "EnumType" -> {
                declarations.add(currentEnum.build());
                currentEnum = null;
            }
            case "Action", "Function" -> currentOperation = null;
            case "EntityContainer" -> currentContainer = null;
            default -> {
            }
        }
    }

    private SchemaModel build() {
        DefaultSchemaModel.DefaultSchemaModelBuilder builder = DefaultSchemaModel.builder();
        for (Object declaration : declarations) {
            builder.element(toSchemaElement(declaration));
        }
        return builder.build();
    }

    private SchemaElement toSchemaElement(Object declaration) {
        if (declaration instanceof RawStructuredType raw) {
            return raw.entity ? buildEntityType(raw) : buildComplexType(raw);
        }
        if (declaration instanceof RawOperation raw) {
            return EdmOperation.builder()
                    .namespace(raw.namespace)
                    .name(raw.name)
                    .schemaElementKind(raw.kind)
                    .bound(raw.bound)
                    .parameterTypes(raw.parameterTypes.stream().map(this::qualify).toList())
                    .returnType(raw.returnType == null ? null : qualify(raw.returnType))
                    .build();
        }
        if (declaration instanceof RawContainer raw) {
            EntityContainer.EntityContainerBuilder container = EntityContainer.builder()
                    .namespace(raw.namespace)
                    .name(raw.name);
            for (String[] set : raw.entitySets) {
                container.entitySet(new EntitySet(set[0], qualify(set[1])));
            }
            return container.build();
        }
        return (SchemaElement) declaration;
    }

    private EntityType buildEntityType(RawStructuredType raw) {
        List<RawStructuredType> hierarchy = hierarchy(raw);
        EntityType.EntityTypeBuilder builder = EntityType.builder()
                .namespace(raw.namespace)
                .name(raw.name)
                .baseTypeName(raw.baseType == null ? null : qualify(raw.baseType))
                .abstractType(raw.abstractType)
                .openType(raw.openType)
                .hasStream(raw.hasStream);

        List<String> key = List.of();
        for (RawStructuredType level : hierarchy) {
            if (!level.key.isEmpty()) {
                key = level.key;
            }
            level.properties.forEach(p -> builder.property(toProperty(p)));
            level.navigations.forEach(n -> builder.navigation(toNavigation(n, level.fullName())));
        }
        builder.declaredKey(key);
        return builder.build();
    }

    private ComplexType buildComplexType(RawStructuredType raw) {
        ComplexType.ComplexTypeBuilder builder = ComplexType.builder()
                .namespace(raw.namespace)
                .name(raw.name)
                .baseTypeName(raw.baseType == null ? null : qualify(raw.baseType))
                .abstractType(raw.abstractType)
                .openType(raw.openType);
        for (RawStructuredType level : hierarchy(raw)) {
            level.properties.forEach(p -> builder.property(toProperty(p)));
        }
        return builder.build();
    }

    /**
     * The type and its ancestors, root first.
     */
    private List<RawStructuredType> hierarchy(RawStructuredType raw) {
        List<RawStructuredType> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        RawStructuredType current = raw;
        while (current != null && seen.add(current.fullName())) {
            chain.add(0, current);
            current = current.baseType == null ? null : structuredTypes.get(qualify(current.baseType));
        }
        return chain;
    }

    private StructuralProperty toProperty(RawProperty raw) {
        return StructuralProperty.builder()
                .name(raw.name)
                .type(typeReference(raw.typeName, raw.nullable))
                .defaultValue(raw.defaultValue)
                .concurrencyMode(raw.concurrencyMode)
                .build();
    }

    private NavigationProperty toNavigation(RawNavigation raw, String declaringTypeName) {
        return NavigationProperty.builder()
                .name(raw.name)
                .type(typeReference(raw.typeName, raw.nullable))
                .declaringTypeName(declaringTypeName)
                .partnerName(raw.partner)
                .containsTarget(raw.containsTarget)
                .dependentProperties(raw.dependentProperties)
                .onDelete(raw.onDelete)
                .build();
    }

    private EdmTypeReference typeReference(String typeName, boolean nullable) {
        if (EdmTypeReference.isCollectionName(typeName)) {
            return EdmTypeReference.collectionOf(typeReference(EdmTypeReference.elementTypeName(typeName), nullable));
        }
        var primitive = EdmPrimitiveKind.fromEdmName(typeName);
        if (primitive.isPresent()) {
            return EdmTypeReference.primitive(primitive.get(), nullable);
        }
        String qualified = qualify(typeName);
        EdmTypeKind kind = declaredKinds.getOrDefault(qualified, EdmTypeKind.UNTYPED);
        return EdmTypeReference.builder()
                .kind(kind)
                .fullName(qualified)
                .nullable(nullable)
                .build();
    }

    /**
     * Replace a schema alias prefix with its namespace.
     */
    private String qualify(String typeName) {
        if (EdmTypeReference.isCollectionName(typeName)) {
            return "Collection(" + qualify(EdmTypeReference.elementTypeName(typeName)) + ")";
        }
        int dot = typeName.lastIndexOf('.');
        if (dot > 0) {
            String namespace = aliases.get(typeName.substring(0, dot));
            if (namespace != null) {
                return namespace + typeName.substring(dot);
            }
        }
        return typeName;
    }

    private static String attr(XMLStreamReader reader, String name) {
        return reader.getAttributeValue(null, name);
    }

    private static String required(XMLStreamReader reader, String name) {
        String value = attr(reader, name);
        if (value == null) {
            throw new MetadataException(String.format("Element %s at line %d is missing attribute %s",
                    reader.getLocalName(), reader.getLocation().getLineNumber(), name));
        }
        return value;
    }

    private static boolean bool(XMLStreamReader reader, String name, boolean defaultValue) {
        String value = attr(reader, name);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new MetadataException("Invalid enum member value: " + value, e);
        }
    }

    private static final class RawStructuredType {
        final String namespace;
        final String name;
        final boolean entity;
        String baseType;
        boolean abstractType;
        boolean openType;
        boolean hasStream;
        final List<String> key = new ArrayList<>();
        final List<RawProperty> properties = new ArrayList<>();
        final List<RawNavigation> navigations = new ArrayList<>();

        RawStructuredType(String namespace, String name, boolean entity) {
            this.namespace = namespace;
            this.name = name;
            this.entity = entity;
        }

        String fullName() {
            return namespace + "." + name;
        }
    }

    private static final class RawProperty {
        String name;
        String typeName;
        boolean nullable;
        String defaultValue;
        ConcurrencyMode concurrencyMode;
    }

    private static final class RawNavigation {
        String name;
        String typeName;
        boolean nullable;
        String partner;
        boolean containsTarget;
        final List<String> dependentProperties = new ArrayList<>();
        OnDeleteAction onDelete = OnDeleteAction.NONE;
    }

    private static final class RawOperation {
        String namespace;
        String name;
        SchemaElementKind kind;
        boolean bound;
        final List<String> parameterTypes = new ArrayList<>();
        String returnType;
    }

    private static final class RawContainer {
        String namespace;
        String name;
        final List<String[]> entitySets = new ArrayList<>();
    }
}
