package com.odata.writer.spatial;

public enum SpatialShape {
    POINT("Point"),
    LINE_STRING("LineString"),
    POLYGON("Polygon"),
    MULTI_POINT("MultiPoint"),
    MULTI_LINE_STRING("MultiLineString"),
    MULTI_POLYGON("MultiPolygon"),
    COLLECTION("GeometryCollection");

    private final String geoJsonType;

    SpatialShape(String geoJsonType) {
        this.geoJsonType = geoJsonType;
    }

    public String getGeoJsonType() {
        return geoJsonType;
    }
}
