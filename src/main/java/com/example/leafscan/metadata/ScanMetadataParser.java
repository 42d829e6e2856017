package com.example.leafscan.metadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads scan identity from the filename and the header/footer blocks from the comment lines.
 */
public class ScanMetadataParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanMetadataParser.class);

    public static final String COMMENT_MARKER = "#";

    private static final Pattern FILE_NAME = Pattern.compile(
            "(\\w{8})_(\\d{4})_(hemi|hinge|ground)_(\\d{8})-(\\d{6})Z_(\\d{4})_(\\d{4})\\.csv");
    private static final DateTimeFormatter START_TIME = DateTimeFormatter.ofPattern("uuuuMMddHHmmss");
    private static final String FINISHED_MARKER = "Finished";
    private static final String GPS_MARKER = "GPS";
    private static final int GPS_PREFIX_LENGTH = 4;
    // Telemetry keys whose values carry a trailing unit, e.g. "12.4 V".
    private static final Set<String> UNIT_KEYS = Set.of(
            "Batt",
            "Curr",
            "Lidar Temp",
            "Motor Temp",
            "Encl. Temp",
            "Encl. humidity"
    );

    /**
     * Decodes the identity fields of a scan filename, or returns empty (with a warning) when the
     * name does not follow the scan naming scheme.
     */
    public Optional<ScanIdentity> parseFileName(Path path) {
        String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        Matcher matcher = FILE_NAME.matcher(name);
        if (!matcher.matches()) {
            LOGGER.warn("{} is not a recognized LEAF scan file", path);
            return Optional.empty();
        }
        LocalDateTime start;
        try {
            start = LocalDateTime.parse(matcher.group(4) + matcher.group(5), START_TIME);
        } catch (DateTimeParseException ex) {
            LOGGER.warn("{} is not a recognized LEAF scan file: bad timestamp", path, ex);
            return Optional.empty();
        }
        return Optional.of(new ScanIdentity(
                matcher.group(1),
                Integer.parseInt(matcher.group(2)),
                ScanType.fromToken(matcher.group(3)),
                start.toInstant(ZoneOffset.UTC),
                Integer.parseInt(matcher.group(6)),
                Integer.parseInt(matcher.group(7))
        ));
    }

    /**
     * Builds the file metadata from its name and its lines in file order. Comment lines seen
     * before the first data line form the header, later ones the footer.
     */
    public ScanFileMetadata parse(Path path, List<String> lines) {
        Optional<ScanIdentity> identity = parseFileName(path);
        Map<String, HeaderValue> header = new LinkedHashMap<>();
        Map<String, HeaderValue> footer = new LinkedHashMap<>();
        OptionalDouble duration = OptionalDouble.empty();
        List<String> gpsFix = List.of();
        boolean inHeader = true;

        for (String line : lines) {
            if (!line.startsWith(COMMENT_MARKER)) {
                if (!line.isBlank()) {
                    inHeader = false;
                }
                continue;
            }
            if (line.contains(FINISHED_MARKER)) {
                duration = parseDuration(path, line).map(OptionalDouble::of).orElse(duration);
            } else if (line.contains(GPS_MARKER)) {
                String remainder = line.length() > GPS_PREFIX_LENGTH ? line.substring(GPS_PREFIX_LENGTH) : "";
                gpsFix = List.of(remainder.strip().split(",", -1));
            } else {
                int colon = line.indexOf(':');
                if (colon < 0) {
                    LOGGER.warn("Ignoring comment line without key in {}: {}", path, line.strip());
                    continue;
                }
                String key = line.substring(COMMENT_MARKER.length(), colon).strip();
                String value = line.substring(colon + 1).strip();
                if (UNIT_KEYS.contains(key)) {
                    value = firstToken(value);
                }
                (inHeader ? header : footer).put(key, HeaderValue.parse(value));
            }
        }

        return new ScanFileMetadata(
                identity,
                Collections.unmodifiableMap(header),
                Collections.unmodifiableMap(footer),
                duration,
                gpsFix
        );
    }

    private Optional<Double> parseDuration(Path path, String line) {
        String[] parts = line.strip().split("\\s+");
        if (parts.length > 2) {
            try {
                return Optional.of(Double.parseDouble(parts[2]));
            } catch (NumberFormatException ex) {
                LOGGER.warn("Unreadable scan duration in {}: {}", path, line.strip());
                return Optional.empty();
            }
        }
        LOGGER.warn("Unreadable scan duration in {}: {}", path, line.strip());
        return Optional.empty();
    }

    private static String firstToken(String value) {
        String[] tokens = value.split("\\s+");
        return tokens.length == 0 ? "" : tokens[0];
    }
}
