package com.example.leafscan;

import java.util.Optional;

/**
 * Immutable settings applied while turning a scan body into point records.
 *
 * @param maxRange     ranges beyond this distance are treated as missing
 * @param transform    whether the header tilt vector is applied to every shot
 * @param sensorHeight height of the instrument above ground; enables per-return heights
 * @param zenithOffset constant bias (radians) added to the raw zenith angle
 */
public record ScanReaderConfig(
        double maxRange,
        boolean transform,
        Optional<Double> sensorHeight,
        double zenithOffset
) {
    public static final double DEFAULT_MAX_RANGE = 120;

    public ScanReaderConfig {
        if (!(maxRange > 0) || Double.isInfinite(maxRange)) {
            throw new IllegalArgumentException("maxRange must be a positive finite distance: " + maxRange);
        }
        sensorHeight = sensorHeight == null ? Optional.empty() : sensorHeight;
    }

    public static ScanReaderConfig defaults() {
        return new ScanReaderConfig(DEFAULT_MAX_RANGE, true, Optional.empty(), 0);
    }

    public ScanReaderConfig withMaxRange(double value) {
        return new ScanReaderConfig(value, transform, sensorHeight, zenithOffset);
    }

    public ScanReaderConfig withTransform(boolean value) {
        return new ScanReaderConfig(maxRange, value, sensorHeight, zenithOffset);
    }

    public ScanReaderConfig withSensorHeight(double value) {
        return new ScanReaderConfig(maxRange, transform, Optional.of(value), zenithOffset);
    }

    public ScanReaderConfig withZenithOffset(double value) {
        return new ScanReaderConfig(maxRange, transform, sensorHeight, value);
    }
}
