package com.example.leafscan;

import java.time.Instant;

/**
 * One row of the instrument power/telemetry log.
 */
public record PowerRecord(
        Instant timestamp,
        double batteryVoltage,
        double current,
        double temperature,
        double humidity
) {
}
