package com.example.leafscan.geometry;

/**
 * Radius, zenith (theta) and azimuth (phi) in radians.
 */
public record SphericalCoordinate(
        double radius,
        double zenith,
        double azimuth
) {
}
