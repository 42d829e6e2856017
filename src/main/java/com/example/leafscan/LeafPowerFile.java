package com.example.leafscan;

import com.example.leafscan.metadata.PowerFileIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed LEAF power log: headerless rows of timestamp, battery voltage, current,
 * temperature and humidity.
 */
public final class LeafPowerFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(LeafPowerFile.class);

    private static final int COLUMNS = 5;
    private static final Pattern FILE_NAME = Pattern.compile("(\\w{8})_pwr_(\\d{8})\\.csv");
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("uuuuMMdd");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("uuuuMMdd-HHmmss");

    private final Path path;
    private final Optional<PowerFileIdentity> identity;
    private final List<PowerRecord> records;
    private final int truncatedRecordCount;
    private final int malformedRecordCount;

    public LeafPowerFile(Path path) throws IOException {
        this.path = path;
        this.identity = parseFileName(path);

        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }

        DelimitedRows rows = DelimitedRows.split(lines, COLUMNS, String::isEmpty);
        if (rows.truncatedCount() > 0) {
            LOGGER.warn("{} truncated records were ignored in {}", rows.truncatedCount(), path);
        }
        int malformed = rows.oversizedCount();
        List<PowerRecord> parsed = new ArrayList<>(rows.rows().size());
        for (String[] fields : rows.rows()) {
            try {
                parsed.add(toRecord(fields));
            } catch (DateTimeParseException | NumberFormatException ex) {
                malformed++;
                LOGGER.debug("Unreadable power record in {}: {}", path, String.join(",", fields), ex);
            }
        }
        if (malformed > 0) {
            LOGGER.warn("Skipped {} malformed records in {}", malformed, path);
        }
        this.records = Collections.unmodifiableList(parsed);
        this.truncatedRecordCount = rows.truncatedCount();
        this.malformedRecordCount = malformed;
    }

    static Optional<PowerFileIdentity> parseFileName(Path path) {
        String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        Matcher matcher = FILE_NAME.matcher(name);
        if (matcher.matches()) {
            try {
                return Optional.of(new PowerFileIdentity(matcher.group(1), LocalDate.parse(matcher.group(2), FILE_DATE)));
            } catch (DateTimeParseException ex) {
                LOGGER.warn("{} is not a recognized LEAF power file: bad date", path, ex);
                return Optional.empty();
            }
        }
        LOGGER.warn("{} is not a recognized LEAF power file", path);
        return Optional.empty();
    }

    private static PowerRecord toRecord(String[] fields) {
        Instant timestamp = LocalDateTime.parse(fields[0], TIMESTAMP).toInstant(ZoneOffset.UTC);
        return new PowerRecord(
                timestamp,
                parseReading(fields[1]),
                parseReading(fields[2]),
                parseReading(fields[3]),
                Double.parseDouble(fields[4])
        );
    }

    private static double parseReading(String field) {
        return field.isEmpty() ? Double.NaN : Double.parseDouble(field);
    }

    public Path path() {
        return path;
    }

    public Optional<PowerFileIdentity> identity() {
        return identity;
    }

    public List<PowerRecord> records() {
        return records;
    }

    public int truncatedRecordCount() {
        return truncatedRecordCount;
    }

    public int malformedRecordCount() {
        return malformedRecordCount;
    }
}
