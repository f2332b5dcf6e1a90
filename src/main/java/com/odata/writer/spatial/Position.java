package com.odata.writer.spatial;

import lombok.Value;

/**
 * A coordinate pair. For geography values {@code x} is longitude and {@code y} latitude.
 */
@Value
public class Position {
    double x;
    double y;

    public static Position of(double x, double y) {
        return new Position(x, y);
    }
}
