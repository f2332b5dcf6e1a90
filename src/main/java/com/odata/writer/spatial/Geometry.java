package com.odata.writer.spatial;

import java.util.List;

/**
 * Planar (flat-earth) spatial values.
 */
public abstract class Geometry extends SpatialValue {

    public static final int DEFAULT_SRID = 0;

    protected Geometry(SpatialShape shape, int srid, Object coordinates) {
        super(shape, srid, coordinates);
    }

    protected Geometry(int srid, List<? extends Geometry> members) {
        super(srid, members);
    }

    public static Point point(double x, double y) {
        return new Point(DEFAULT_SRID, Position.of(x, y));
    }

    public static final class Point extends Geometry {
        public Point(int srid, Position position) {
            super(SpatialShape.POINT, srid, position);
        }
    }

    public static final class LineString extends Geometry {
        public LineString(int srid, List<Position> positions) {
            super(SpatialShape.LINE_STRING, srid, List.copyOf(positions));
        }
    }

    public static final class Polygon extends Geometry {
        public Polygon(int srid, List<List<Position>> rings) {
            super(SpatialShape.POLYGON, srid, List.copyOf(rings));
        }
    }

    public static final class MultiPoint extends Geometry {
        public MultiPoint(int srid, List<Position> positions) {
            super(SpatialShape.MULTI_POINT, srid, List.copyOf(positions));
        }
    }

    public static final class MultiLineString extends Geometry {
        public MultiLineString(int srid, List<List<Position>> lines) {
            super(SpatialShape.MULTI_LINE_STRING, srid, List.copyOf(lines));
        }
    }

    public static final class MultiPolygon extends Geometry {
        public MultiPolygon(int srid, List<List<List<Position>>> polygons) {
            super(SpatialShape.MULTI_POLYGON, srid, List.copyOf(polygons));
        }
    }

    public static final class Collection extends Geometry {
        public Collection(int srid, List<? extends Geometry> members) {
            super(srid, members);
        }
    }
}
