package com.example.leafscan;

import java.util.OptionalDouble;

/**
 * Cartesian position of one return; coordinates are NaN when the range is missing.
 * The height is present only when a sensor height was configured.
 */
public record ReturnPoint(
        double x,
        double y,
        double z,
        OptionalDouble height
) {
    public boolean isMissing() {
        return Double.isNaN(x);
    }
}
