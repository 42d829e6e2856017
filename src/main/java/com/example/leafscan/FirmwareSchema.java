package com.example.leafscan;

import java.util.List;

/**
 * Column layout and encoder resolution of a scan body, chosen by firmware version.
 */
public enum FirmwareSchema {
    LEGACY(List.of("sample_count", "scan_encoder", "rotary_encoder",
            "range1", "intensity1", "range2", "sample_time"), 10_000),
    DUAL_INTENSITY(List.of("sample_count", "scan_encoder", "rotary_encoder",
            "range1", "intensity1", "range2", "intensity2", "sample_time"), 25_600);

    public static final double THRESHOLD_VERSION = 4.11;
    public static final double AZIMUTH_STEPS = 20_000;

    private final List<String> columns;
    private final double zenithSteps;

    FirmwareSchema(List<String> columns, double zenithSteps) {
        this.columns = columns;
        this.zenithSteps = zenithSteps;
    }

    public static FirmwareSchema forVersion(double version) {
        return version >= THRESHOLD_VERSION ? DUAL_INTENSITY : LEGACY;
    }

    /**
     * Picks the schema whose width matches a data row; used when the header names no firmware.
     */
    public static FirmwareSchema forColumnCount(int columnCount) {
        return columnCount >= DUAL_INTENSITY.columnCount() ? DUAL_INTENSITY : LEGACY;
    }

    public List<String> columns() {
        return columns;
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean hasSecondIntensity() {
        return this == DUAL_INTENSITY;
    }

    public double zenithSteps() {
        return zenithSteps;
    }

    public double azimuthSteps() {
        return AZIMUTH_STEPS;
    }
}
