package com.example.leafscan;

import com.example.leafscan.geometry.CartesianCoordinate;
import com.example.leafscan.geometry.CoordinateTransform;
import com.example.leafscan.geometry.SphericalCoordinate;
import com.example.leafscan.metadata.HeaderValue;
import com.example.leafscan.metadata.ScanFileMetadata;
import com.example.leafscan.metadata.ScanIdentity;
import com.example.leafscan.metadata.ScanType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the data lines of a scan file into cleaned, geometrically corrected {@link ScanRecord}s.
 */
public class ScanDataParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanDataParser.class);

    public static final double MISSING_SENTINEL = -1.0;
    public static final double TILT_SCALE = 1024;

    private static final double TWO_PI = 2 * Math.PI;
    private static final Pattern LEADING_VERSION = Pattern.compile("^(\\d+(?:\\.\\d+)?)");

    private final ScanReaderConfig config;

    public ScanDataParser(ScanReaderConfig config) {
        this.config = config;
    }

    /**
     * Result of parsing one scan body.
     *
     * @param truncatedCount rows dropped because the trailing sample time was missing
     * @param malformedCount rows dropped because they were too wide or not numeric
     */
    public record ParsedBody(
            FirmwareSchema schema,
            List<ScanRecord> records,
            int truncatedCount,
            int malformedCount
    ) {
    }

    private record RawSample(
            int sampleCount,
            double scanEncoder,
            double rotaryEncoder,
            double range1,
            OptionalInt intensity1,
            double range2,
            OptionalInt intensity2,
            double sampleTime
    ) {
    }

    public ParsedBody parse(Path path, ScanFileMetadata metadata, List<String> dataLines) {
        FirmwareSchema schema = resolveSchema(path, metadata, dataLines);
        DelimitedRows rows = DelimitedRows.split(dataLines, schema.columnCount(), ScanDataParser::isMissing);
        if (rows.truncatedCount() > 0) {
            LOGGER.warn("Removed {} truncated records in {}", rows.truncatedCount(), path);
        }
        int malformed = rows.oversizedCount();

        List<RawSample> samples = new ArrayList<>(rows.rows().size());
        for (String[] fields : rows.rows()) {
            try {
                samples.add(toSample(fields, schema));
            } catch (NumberFormatException ex) {
                malformed++;
                LOGGER.debug("Unreadable record in {}: {}", path, String.join(",", fields), ex);
            }
        }
        if (malformed > 0) {
            LOGGER.warn("Skipped {} malformed records in {}", malformed, path);
        }
        if (samples.isEmpty()) {
            return new ParsedBody(schema, List.of(), rows.truncatedCount(), malformed);
        }

        Optional<Instant> start = metadata.identity().map(ScanIdentity::startTime);
        boolean hemi = metadata.scanType().filter(type -> type == ScanType.HEMI).isPresent();
        Optional<SphericalCoordinate> tilt = config.transform() ? tiltOffset(path, metadata) : Optional.empty();
        double[] elapsed = cumulativeSampleTime(samples);

        List<ScanRecord> records = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            RawSample sample = samples.get(i);
            Optional<Instant> timestamp = start.map(plusMillis(elapsed[i]));
            records.add(toRecord(sample, schema, timestamp, tilt, hemi));
        }
        return new ParsedBody(schema, Collections.unmodifiableList(records), rows.truncatedCount(), malformed);
    }

    private ScanRecord toRecord(RawSample sample,
                                FirmwareSchema schema,
                                Optional<Instant> timestamp,
                                Optional<SphericalCoordinate> tilt,
                                boolean hemi) {
        double range1 = validRange(sample.range1(), sample.intensity1());
        double range2 = validRange(sample.range2(), sample.intensity2());
        int targetCount = 2 - (Double.isNaN(range1) ? 1 : 0) + (Double.isNaN(range2) ? 1 : 0);

        double zenith = sample.scanEncoder() / schema.zenithSteps() * TWO_PI + config.zenithOffset();
        double azimuth = sample.rotaryEncoder() / schema.azimuthSteps() * TWO_PI;
        if (tilt.isPresent()) {
            zenith += tilt.get().zenith();
            azimuth += tilt.get().azimuth();
        }
        // hemi scans cover the sphere in two half sweeps; the first one faces backwards
        if (hemi && zenith < Math.PI) {
            azimuth += Math.PI;
        }
        if (azimuth >= TWO_PI) {
            azimuth -= TWO_PI;
        }
        if (azimuth < 0) {
            azimuth += TWO_PI;
            // a tiny negative azimuth can round up to exactly 2π
            if (azimuth >= TWO_PI) {
                azimuth -= TWO_PI;
            }
        }
        zenith = Math.abs(zenith - Math.PI);

        return new ScanRecord(
                sample.sampleCount(),
                sample.scanEncoder(),
                sample.rotaryEncoder(),
                range1,
                sample.intensity1(),
                range2,
                sample.intensity2(),
                sample.sampleTime(),
                timestamp,
                zenith,
                azimuth,
                targetCount,
                project(range1, zenith, azimuth),
                project(range2, zenith, azimuth)
        );
    }

    private ReturnPoint project(double range, double zenith, double azimuth) {
        CartesianCoordinate point = CoordinateTransform.toCartesian(range, zenith, azimuth);
        OptionalDouble height = config.sensorHeight()
                .map(h -> OptionalDouble.of(point.z() + h))
                .orElse(OptionalDouble.empty());
        return new ReturnPoint(point.x(), point.y(), point.z(), height);
    }

    private double validRange(double range, OptionalInt intensity) {
        if (range > config.maxRange()) {
            return Double.NaN;
        }
        if (intensity.isPresent() && intensity.getAsInt() <= 0) {
            return Double.NaN;
        }
        return range;
    }

    private Optional<SphericalCoordinate> tiltOffset(Path path, ScanFileMetadata metadata) {
        Optional<List<Number>> vector = metadata.headerValue(ScanFileMetadata.TILT_KEY).flatMap(HeaderValue::asTuple);
        if (vector.isEmpty() || vector.get().size() != 3) {
            LOGGER.warn("No usable {} header in {}; tilt correction skipped", ScanFileMetadata.TILT_KEY, path);
            return Optional.empty();
        }
        List<Number> v = vector.get();
        double x = v.get(0).doubleValue() / TILT_SCALE;
        double y = v.get(1).doubleValue() / TILT_SCALE;
        double z = v.get(2).doubleValue() / TILT_SCALE;
        if (x == 0 && y == 0 && z == 0) {
            LOGGER.warn("Zero {} vector in {}; tilt correction skipped", ScanFileMetadata.TILT_KEY, path);
            return Optional.empty();
        }
        return Optional.of(CoordinateTransform.toSpherical(x, y, z));
    }

    private FirmwareSchema resolveSchema(Path path, ScanFileMetadata metadata, List<String> dataLines) {
        Optional<HeaderValue> firmware = metadata.headerValue(ScanFileMetadata.FIRMWARE_KEY);
        if (firmware.isPresent()) {
            OptionalDouble version = firmware.get().asDouble();
            if (version.isPresent()) {
                return FirmwareSchema.forVersion(version.getAsDouble());
            }
            Matcher matcher = LEADING_VERSION.matcher(firmware.get().text());
            if (matcher.find()) {
                return FirmwareSchema.forVersion(Double.parseDouble(matcher.group(1)));
            }
        }
        int width = dataLines.stream()
                .filter(line -> !line.isBlank())
                .findFirst()
                .map(line -> line.split(",", -1).length)
                .orElse(FirmwareSchema.LEGACY.columnCount());
        FirmwareSchema inferred = FirmwareSchema.forColumnCount(width);
        LOGGER.warn("No readable firmware version in {}; assuming {} from the data width", path, inferred);
        return inferred;
    }

    private static double[] cumulativeSampleTime(List<RawSample> samples) {
        double[] elapsed = new double[samples.size()];
        double sum = 0;
        for (int i = 0; i < elapsed.length; i++) {
            sum += samples.get(i).sampleTime();
            elapsed[i] = sum;
        }
        return elapsed;
    }

    private static Function<Instant, Instant> plusMillis(double millis) {
        long micros = Math.round(millis * 1000);
        return instant -> instant.plus(micros, ChronoUnit.MICROS);
    }

    private static RawSample toSample(String[] fields, FirmwareSchema schema) {
        int last = schema.columnCount() - 1;
        return new RawSample(
                parseCount(fields[0]),
                parseReading(fields[1]),
                parseReading(fields[2]),
                parseReading(fields[3]),
                parseIntensity(fields[4]),
                parseReading(fields[5]),
                schema.hasSecondIntensity() ? parseIntensity(fields[6]) : OptionalInt.empty(),
                parseReading(fields[last])
        );
    }

    static boolean isMissing(String field) {
        if (field.isEmpty()) {
            return true;
        }
        try {
            return Double.parseDouble(field) == MISSING_SENTINEL;
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    private static double parseReading(String field) {
        return isMissing(field) ? Double.NaN : Double.parseDouble(field);
    }

    private static OptionalInt parseIntensity(String field) {
        double value = parseReading(field);
        return Double.isNaN(value) ? OptionalInt.empty() : OptionalInt.of(toInt(value, field));
    }

    private static int parseCount(String field) {
        return field.isEmpty() ? (int) MISSING_SENTINEL : toInt(Double.parseDouble(field), field);
    }

    private static int toInt(double value, String field) {
        if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw new NumberFormatException("Not an integer: " + field);
        }
        return (int) value;
    }
}
