package com.example.leafscan.metadata;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Everything known about a scan file apart from its measurement rows.
 * The identity is empty when the filename does not follow the scan naming scheme.
 */
public record ScanFileMetadata(
        Optional<ScanIdentity> identity,
        Map<String, HeaderValue> header,
        Map<String, HeaderValue> footer,
        OptionalDouble duration,
        List<String> gpsFix
) {
    public static final String FIRMWARE_KEY = "Firmware ver.";
    public static final String TILT_KEY = "Tilt";

    public Optional<ScanType> scanType() {
        return identity.map(ScanIdentity::scanType);
    }

    public Optional<HeaderValue> headerValue(String key) {
        return Optional.ofNullable(header.get(key));
    }
}
