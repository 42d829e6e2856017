package com.example.leafscan.metadata;

import java.time.Instant;

/**
 * Identity fields decoded from a scan filename such as
 * {@code AB123456_0001_hemi_20221201-103000Z_0360_0720.csv}.
 */
public record ScanIdentity(
        String serialNumber,
        int scanCount,
        ScanType scanType,
        Instant startTime,
        int zenithShotCount,
        int azimuthShotCount
) {
}
