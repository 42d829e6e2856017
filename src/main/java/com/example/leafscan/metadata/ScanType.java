package com.example.leafscan.metadata;

import java.util.Locale;

/**
 * Acquisition geometry encoded in the scan filename.
 */
public enum ScanType {
    HEMI,
    HINGE,
    GROUND;

    public static ScanType fromToken(String token) {
        return valueOf(token.toUpperCase(Locale.ROOT));
    }
}
