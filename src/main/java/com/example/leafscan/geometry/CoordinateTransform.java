package com.example.leafscan.geometry;

/**
 * Right-handed spherical/Cartesian conversions used for scan geometry.
 * Azimuth is measured from +y towards +x, zenith from +z.
 */
public final class CoordinateTransform {
    private static final double TWO_PI = 2 * Math.PI;

    private CoordinateTransform() {
    }

    public static CartesianCoordinate toCartesian(double radius, double zenith, double azimuth) {
        double sinZenith = Math.sin(zenith);
        return new CartesianCoordinate(
                radius * sinZenith * Math.sin(azimuth),
                radius * sinZenith * Math.cos(azimuth),
                radius * Math.cos(zenith)
        );
    }

    /**
     * Converts a point to spherical form. Azimuth comes from {@code atan2(x, y)} and is shifted by
     * a full turn when {@code x < 0}, and back by a full turn when {@code x > 2π}.
     * The second test compares the x coordinate itself against 2π.
     */
    public static SphericalCoordinate toSpherical(double x, double y, double z) {
        double radius = Math.sqrt(x * x + y * y + z * z);
        double zenith = Math.acos(z / radius);
        double azimuth = Math.atan2(x, y);
        if (x < 0) {
            azimuth += TWO_PI;
        }
        if (x > TWO_PI) {
            azimuth -= TWO_PI;
        }
        return new SphericalCoordinate(radius, zenith, azimuth);
    }

    /**
     * Element-wise {@link #toCartesian(double, double, double)}.
     *
     * @return {x[], y[], z[]}
     */
    public static double[][] toCartesian(double[] radius, double[] zenith, double[] azimuth) {
        requireSameLength(radius, zenith, azimuth);
        int n = radius.length;
        double[][] out = new double[3][n];
        for (int i = 0; i < n; i++) {
            CartesianCoordinate point = toCartesian(radius[i], zenith[i], azimuth[i]);
            out[0][i] = point.x();
            out[1][i] = point.y();
            out[2][i] = point.z();
        }
        return out;
    }

    /**
     * Element-wise {@link #toSpherical(double, double, double)}.
     *
     * @return {radius[], zenith[], azimuth[]}
     */
    public static double[][] toSpherical(double[] x, double[] y, double[] z) {
        requireSameLength(x, y, z);
        int n = x.length;
        double[][] out = new double[3][n];
        for (int i = 0; i < n; i++) {
            SphericalCoordinate point = toSpherical(x[i], y[i], z[i]);
            out[0][i] = point.radius();
            out[1][i] = point.zenith();
            out[2][i] = point.azimuth();
        }
        return out;
    }

    private static void requireSameLength(double[] a, double[] b, double[] c) {
        if (a.length != b.length || a.length != c.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length: "
                    + a.length + ", " + b.length + ", " + c.length);
        }
    }
}
