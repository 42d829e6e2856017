package com.example.leafscan;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One cleaned and geometrically corrected scan sample.
 * Missing ranges are NaN; zenith is in [0, π] and azimuth in [0, 2π) radians.
 */
public record ScanRecord(
        int sampleCount,
        double scanEncoder,
        double rotaryEncoder,
        double range1,
        OptionalInt intensity1,
        double range2,
        OptionalInt intensity2,
        double sampleTime,
        Optional<Instant> timestamp,
        double zenith,
        double azimuth,
        int targetCount,
        ReturnPoint return1,
        ReturnPoint return2
) {
}
