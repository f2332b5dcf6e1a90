package com.odata.writer.coercion;

import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.w3c.dom.Node;

import com.odata.writer.exception.ValueFormatException;
import com.odata.writer.model.EdmPrimitiveKind;
import com.odata.writer.spatial.Geography;
import com.odata.writer.spatial.Geometry;

import lombok.experimental.UtilityClass;

import static com.odata.writer.model.EdmPrimitiveKind.*;

/**
 * Fixed mapping between native Java value types and OData primitive wire kinds.
 *
 * The table is an ordered list, not a keyed map: several native types can map to the same
 * wire kind, and {@link #convert(Object, EdmPrimitiveKind)} tries them in declaration order.
 * Conversion success depends on the representation (range checks, parse rules), so the order
 * is part of the contract.
 */
@UtilityClass
public class TypeCoercionTable {

    private static final List<TypeMapping> MAPPINGS = List.of(
            TypeMapping.of(String.class, STRING),
            TypeMapping.of(Boolean.class, BOOLEAN),
            TypeMapping.of(BigDecimal.class, DECIMAL),
            TypeMapping.of(Double.class, DOUBLE),
            TypeMapping.of(UUID.class, GUID),
            TypeMapping.of(Short.class, INT16),
            TypeMapping.of(Integer.class, INT32),
            TypeMapping.of(Long.class, INT64),
            TypeMapping.of(Byte.class, SBYTE),
            TypeMapping.of(Float.class, SINGLE),
            TypeMapping.of(byte[].class, BINARY),
            TypeMapping.of(InputStream.class, STREAM),
            TypeMapping.of(Geography.class, GEOGRAPHY),
            TypeMapping.of(Geography.Point.class, GEOGRAPHY_POINT),
            TypeMapping.of(Geography.LineString.class, GEOGRAPHY_LINE_STRING),
            TypeMapping.of(Geography.Polygon.class, GEOGRAPHY_POLYGON),
            TypeMapping.of(Geography.Collection.class, GEOGRAPHY_COLLECTION),
            TypeMapping.of(Geography.MultiLineString.class, GEOGRAPHY_MULTI_LINE_STRING),
            TypeMapping.of(Geography.MultiPoint.class, GEOGRAPHY_MULTI_POINT),
            TypeMapping.of(Geography.MultiPolygon.class, GEOGRAPHY_MULTI_POLYGON),
            TypeMapping.of(Geometry.class, GEOMETRY),
            TypeMapping.of(Geometry.Point.class, GEOMETRY_POINT),
            TypeMapping.of(Geometry.LineString.class, GEOMETRY_LINE_STRING),
            TypeMapping.of(Geometry.Polygon.class, GEOMETRY_POLYGON),
            TypeMapping.of(Geometry.Collection.class, GEOMETRY_COLLECTION),
            TypeMapping.of(Geometry.MultiLineString.class, GEOMETRY_MULTI_LINE_STRING),
            TypeMapping.of(Geometry.MultiPoint.class, GEOMETRY_MULTI_POINT),
            TypeMapping.of(Geometry.MultiPolygon.class, GEOMETRY_MULTI_POLYGON),
            TypeMapping.of(OffsetDateTime.class, DATE_TIME_OFFSET),
            TypeMapping.of(Duration.class, DURATION),
            TypeMapping.of(LocalDate.class, DATE),
            TypeMapping.of(LocalTime.class, TIME_OF_DAY),

            // widenings and alternate representations
            TypeMapping.of(Node.class, STRING),
            TypeMapping.of(Short.class, BYTE, TypeCoercionTable::isUnsignedByte),
            TypeMapping.of(BigInteger.class, INT64),
            TypeMapping.of(char[].class, STRING),
            TypeMapping.of(Character.class, STRING),
            TypeMapping.of(Instant.class, DATE_TIME_OFFSET),
            TypeMapping.of(ZonedDateTime.class, DATE_TIME_OFFSET),
            TypeMapping.of(LocalDateTime.class, DATE_TIME_OFFSET),
            TypeMapping.of(Date.class, DATE_TIME_OFFSET)
    );

    public List<TypeMapping> mappings() {
        return MAPPINGS;
    }

    /**
     * Wire kind for a native type: the first row declaring exactly that type, otherwise the
     * first row whose type is a supertype of it.
     */
    public Optional<EdmPrimitiveKind> resolve(Class<?> sourceType) {
        for (TypeMapping mapping : MAPPINGS) {
            if (mapping.getNativeType() == sourceType) {
                return Optional.of(mapping.getWireKind());
            }
        }
        return MAPPINGS.stream()
                .filter(mapping -> mapping.handles(sourceType))
                .map(TypeMapping::getWireKind)
                .findFirst();
    }

    /**
     * Native representations for a wire kind, in table order.
     */
    public List<TypeMapping> candidates(EdmPrimitiveKind wireKind) {
        return MAPPINGS.stream()
                .filter(mapping -> mapping.getWireKind() == wireKind)
                .toList();
    }

    /**
     * Convert a value to the first native representation of the given wire kind that accepts it.
     * Values of kinds without any table entry pass through unchanged.
     *
     * @throws ValueFormatException if no candidate representation accepts the value
     */
    public Object convert(Object value, EdmPrimitiveKind wireKind) {
        if (value == null) {
            return null;
        }
        List<TypeMapping> candidates = candidates(wireKind);
        if (candidates.isEmpty()) {
            return value;
        }
        for (TypeMapping candidate : candidates) {
            Optional<Object> converted = ValueConverter.tryConvert(value, candidate.getNativeType())
                    .filter(candidate.getConstraint());
            if (converted.isPresent()) {
                return converted.get();
            }
        }
        throw new ValueFormatException(value.getClass(), wireKind);
    }

    private static boolean isUnsignedByte(Object value) {
        short s = (Short) value;
        return s >= 0 && s <= 255;
    }
}
