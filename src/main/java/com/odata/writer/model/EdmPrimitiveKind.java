package com.odata.writer.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Primitive wire kinds understood by the OData payload formats.
 */
public enum EdmPrimitiveKind {
    BINARY("Binary"),
    BOOLEAN("Boolean"),
    BYTE("Byte"),
    DATE("Date"),
    DATE_TIME_OFFSET("DateTimeOffset"),
    DECIMAL("Decimal"),
    DOUBLE("Double"),
    DURATION("Duration"),
    GUID("Guid"),
    INT16("Int16"),
    INT32("Int32"),
    INT64("Int64"),
    SBYTE("SByte"),
    SINGLE("Single"),
    STREAM("Stream"),
    STRING("String"),
    TIME_OF_DAY("TimeOfDay"),
    GEOGRAPHY("Geography"),
    GEOGRAPHY_POINT("GeographyPoint"),
    GEOGRAPHY_LINE_STRING("GeographyLineString"),
    GEOGRAPHY_POLYGON("GeographyPolygon"),
    GEOGRAPHY_COLLECTION("GeographyCollection"),
    GEOGRAPHY_MULTI_POINT("GeographyMultiPoint"),
    GEOGRAPHY_MULTI_LINE_STRING("GeographyMultiLineString"),
    GEOGRAPHY_MULTI_POLYGON("GeographyMultiPolygon"),
    GEOMETRY("Geometry"),
    GEOMETRY_POINT("GeometryPoint"),
    GEOMETRY_LINE_STRING("GeometryLineString"),
    GEOMETRY_POLYGON("GeometryPolygon"),
    GEOMETRY_COLLECTION("GeometryCollection"),
    GEOMETRY_MULTI_POINT("GeometryMultiPoint"),
    GEOMETRY_MULTI_LINE_STRING("GeometryMultiLineString"),
    GEOMETRY_MULTI_POLYGON("GeometryMultiPolygon");

    private static final String EDM_NAMESPACE = "Edm.";

    private final String simpleName;

    EdmPrimitiveKind(String simpleName) {
        this.simpleName = simpleName;
    }

    public String getSimpleName() {
        return simpleName;
    }

    /**
     * Qualified CSDL name, e.g. {@code Edm.Int32}.
     */
    public String getEdmName() {
        return EDM_NAMESPACE + simpleName;
    }

    public boolean isSpatial() {
        return ordinal() >= GEOGRAPHY.ordinal();
    }

    public static Optional<EdmPrimitiveKind> fromEdmName(String name) {
        if (name == null || !name.startsWith(EDM_NAMESPACE)) {
            return Optional.empty();
        }
        String simple = name.substring(EDM_NAMESPACE.length());
        return Arrays.stream(values())
                .filter(kind -> kind.simpleName.equals(simple))
                .findFirst();
    }

    @Override
    public String toString() {
        return getEdmName();
    }
}
