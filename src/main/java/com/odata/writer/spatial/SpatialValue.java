package com.odata.writer.spatial;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Base class of geography and geometry values.
 *
 * Coordinates are held as nested lists mirroring GeoJSON: a {@link Position} for points,
 * {@code List<Position>} for line strings and multi points, and so on.
 * Collections hold member values instead of coordinates.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class SpatialValue {
    private final SpatialShape shape;
    private final int srid;
    private final Object coordinates;
    private final List<? extends SpatialValue> members;

    protected SpatialValue(SpatialShape shape, int srid, Object coordinates) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.srid = srid;
        this.coordinates = Objects.requireNonNull(coordinates, "coordinates");
        this.members = List.of();
    }

    protected SpatialValue(int srid, List<? extends SpatialValue> members) {
        this.shape = SpatialShape.COLLECTION;
        this.srid = srid;
        this.coordinates = List.of();
        this.members = List.copyOf(members);
    }

    /**
     * GeoJSON object as written by the JSON payload format.
     */
    public Map<String, Object> toGeoJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", shape.getGeoJsonType());
        if (shape == SpatialShape.COLLECTION) {
            List<Map<String, Object>> geometries = new ArrayList<>();
            for (SpatialValue member : members) {
                Map<String, Object> memberJson = member.toGeoJson();
                memberJson.remove("crs");
                geometries.add(memberJson);
            }
            json.put("geometries", geometries);
        } else {
            json.put("coordinates", toJsonCoordinates(coordinates));
        }
        json.put("crs", Map.of("type", "name", "properties", Map.of("name", "EPSG:" + srid)));
        return json;
    }

    /**
     * Extended well-known text, e.g. {@code SRID=4326;POINT(-122.1 47.6)}.
     */
    public String toWellKnownText() {
        return "SRID=" + srid + ";" + wktBody();
    }

    private String wktBody() {
        if (shape == SpatialShape.COLLECTION) {
            return "GEOMETRYCOLLECTION(" + members.stream()
                    .map(SpatialValue::wktBody)
                    .collect(Collectors.joining(",")) + ")";
        }
        return shape.getGeoJsonType().toUpperCase(Locale.ROOT) + toWktCoordinates(coordinates, shape == SpatialShape.POINT);
    }

    private static Object toJsonCoordinates(Object value) {
        if (value instanceof Position p) {
            return List.of(p.getX(), p.getY());
        }
        List<Object> out = new ArrayList<>();
        for (Object item : (List<?>) value) {
            out.add(toJsonCoordinates(item));
        }
        return out;
    }

    private static String toWktCoordinates(Object value, boolean wrapPosition) {
        if (value instanceof Position p) {
            String pair = format(p.getX()) + " " + format(p.getY());
            return wrapPosition ? "(" + pair + ")" : pair;
        }
        return ((List<?>) value).stream()
                .map(item -> toWktCoordinates(item, false))
                .collect(Collectors.joining(",", "(", ")"));
    }

    private static String format(double d) {
        return d == Math.rint(d) && !Double.isInfinite(d) ? String.valueOf((long) d) : String.valueOf(d);
    }
}
