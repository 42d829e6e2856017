package com.example.leafscan.metadata;

import java.time.LocalDate;

/**
 * Identity fields decoded from a power log filename such as {@code AB123456_pwr_20221201.csv}.
 */
public record PowerFileIdentity(
        String serialNumber,
        LocalDate date
) {
}
