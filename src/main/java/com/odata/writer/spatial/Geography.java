package com.odata.writer.spatial;

import java.util.List;

/**
 * Geodetic (round-earth) spatial values.
 */
public abstract class Geography extends SpatialValue {

    public static final int DEFAULT_SRID = 4326;

    protected Geography(SpatialShape shape, int srid, Object coordinates) {
        super(shape, srid, coordinates);
    }

    protected Geography(int srid, List<? extends Geography> members) {
        super(srid, members);
    }

    public static Point point(double x, double y) {
        return new Point(DEFAULT_SRID, Position.of(x, y));
    }

    public static final class Point extends Geography {
        public Point(int srid, Position position) {
            super(SpatialShape.POINT, srid, position);
        }
    }

    public static final class LineString extends Geography {
        public LineString(int srid, List<Position> positions) {
            super(SpatialShape.LINE_STRING, srid, List.copyOf(positions));
        }
    }

    public static final class Polygon extends Geography {
        public Polygon(int srid, List<List<Position>> rings) {
            super(SpatialShape.POLYGON, srid, List.copyOf(rings));
        }
    }

    public static final class MultiPoint extends Geography {
        public MultiPoint(int srid, List<Position> positions) {
            super(SpatialShape.MULTI_POINT, srid, List.copyOf(positions));
        }
    }

    public static final class MultiLineString extends Geography {
        public MultiLineString(int srid, List<List<Position>> lines) {
            super(SpatialShape.MULTI_LINE_STRING, srid, List.copyOf(lines));
        }
    }

    public static final class MultiPolygon extends Geography {
        public MultiPolygon(int srid, List<List<List<Position>>> polygons) {
            super(SpatialShape.MULTI_POLYGON, srid, List.copyOf(polygons));
        }
    }

    public static final class Collection extends Geography {
        public Collection(int srid, List<? extends Geography> members) {
            super(srid, members);
        }
    }
}
