package com.example.leafscan;

import com.example.leafscan.metadata.ScanType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LeafScanFileTest {
    private static final double EPSILON = 1e-9;
    private static final String HEMI_NAME = "AB123456_0001_hemi_20221201-103000Z_0360_0720.csv";
    private static final String HINGE_NAME = "AB123456_0002_hinge_20221201-103000Z_0360_0720.csv";

    @Test
    void cleansDualIntensityBody() throws Exception {
        Path file = write(HEMI_NAME,
                "# Firmware ver.: 4.11",
                "# Tilt: (0, 0, 1024)",
                "1,12800,0,10.0,100,-1,-1,1.5",
                "2,12800,5000,150.0,100,20.0,50,1.5",
                "3,12800,0,10.0,100,20.0,0",
                "4,12800,0,10.0,0,20.0,50,2.0",
                "5,12800,0,10.0,100,20.0,50,-1",
                "# Finished: 12.5 s");

        LeafScanFile scan = new LeafScanFile(file, ScanReaderConfig.defaults().withSensorHeight(1.5));

        assertEquals(FirmwareSchema.DUAL_INTENSITY, scan.schema());
        assertEquals(2, scan.truncatedRecordCount());
        assertEquals(0, scan.malformedRecordCount());
        assertEquals(12.5, scan.metadata().duration().getAsDouble());
        List<ScanRecord> records = scan.records();
        assertEquals(List.of(1, 2, 4), records.stream().map(ScanRecord::sampleCount).toList());

        ScanRecord first = records.get(0);
        assertEquals(10.0, first.range1());
        assertTrue(Double.isNaN(first.range2()));
        assertTrue(first.intensity2().isEmpty());
        assertEquals(3, first.targetCount());
        assertEquals(0, first.zenith(), EPSILON);
        assertEquals(0, first.azimuth(), EPSILON);
        assertEquals(10, first.return1().z(), EPSILON);
        assertEquals(11.5, first.return1().height().getAsDouble(), EPSILON);
        assertTrue(first.return2().isMissing());

        ScanRecord second = records.get(1);
        assertTrue(Double.isNaN(second.range1()));
        assertEquals(1, second.targetCount());
        assertEquals(Math.PI / 2, second.azimuth(), EPSILON);

        ScanRecord fourth = records.get(2);
        assertTrue(Double.isNaN(fourth.range1()));
        assertEquals(20.0, fourth.range2());
        assertEquals(1, fourth.targetCount());
    }

    @Test
    void accumulatesSampleTimeFromStart() throws Exception {
        Path file = write(HINGE_NAME,
                "# Firmware ver.: 4.11",
                "1,0,0,10.0,100,20.0,50,1.5",
                "2,0,0,10.0,100,20.0,50,1.5",
                "3,0,0,10.0,100,20.0,50,2.0");

        List<ScanRecord> records = new LeafScanFile(file).records();

        Instant start = Instant.parse("2022-12-01T10:30:00Z");
        assertEquals(start.plusNanos(1_500_000), records.get(0).timestamp().orElseThrow());
        assertEquals(start.plusNanos(3_000_000), records.get(1).timestamp().orElseThrow());
        assertEquals(start.plusNanos(5_000_000), records.get(2).timestamp().orElseThrow());
    }

    @Test
    void dropsRangesBeyondMaximum() throws Exception {
        Path file = write(HINGE_NAME,
                "# Firmware ver.: 4.11",
                "1,0,0,150.0,100,20.0,50,1.0",
                "2,0,0,100.0,100,20.0,50,1.0");

        List<ScanRecord> defaults = new LeafScanFile(file).records();
        assertTrue(Double.isNaN(defaults.get(0).range1()));
        assertEquals(1, defaults.get(0).targetCount());
        assertEquals(2, defaults.get(1).targetCount());

        List<ScanRecord> shortRange = new LeafScanFile(file, ScanReaderConfig.defaults().withMaxRange(50)).records();
        assertTrue(Double.isNaN(shortRange.get(1).range1()));
        assertTrue(shortRange.get(1).return1().isMissing());
    }

    @Test
    void readsLegacySevenColumnBody() throws Exception {
        Path file = write(HINGE_NAME,
                "# Firmware ver.: 4.1",
                "1,5000,0,10.0,100,20.0,1.0",
                "2,5000,0,10.0,100,20.0,50,1.0");

        LeafScanFile scan = new LeafScanFile(file);

        assertEquals(FirmwareSchema.LEGACY, scan.schema());
        assertEquals(1, scan.records().size());
        assertEquals(1, scan.malformedRecordCount());
        ScanRecord record = scan.records().get(0);
        assertTrue(record.intensity2().isEmpty());
        assertEquals(20.0, record.range2());
        assertEquals(1.0, record.sampleTime());
        assertEquals(0, record.zenith(), EPSILON);
    }

    @Test
    void selectsDualIntensitySchemaFromVersionThreshold() throws Exception {
        assertEquals(FirmwareSchema.DUAL_INTENSITY, FirmwareSchema.forVersion(4.11));
        assertEquals(FirmwareSchema.DUAL_INTENSITY, FirmwareSchema.forVersion(5.0));
        assertEquals(FirmwareSchema.LEGACY, FirmwareSchema.forVersion(4.1));
        assertEquals(25_600, FirmwareSchema.DUAL_INTENSITY.zenithSteps());
        assertEquals(10_000, FirmwareSchema.LEGACY.zenithSteps());

        Path dotted = write(HINGE_NAME, "# Firmware ver.: 4.11.2", "1,0,0,10.0,100,20.0,50,1.0");
        assertEquals(FirmwareSchema.DUAL_INTENSITY, new LeafScanFile(dotted).schema());

        Path unnamed = write(HINGE_NAME, "1,0,0,10.0,100,20.0,50,1.0");
        assertEquals(FirmwareSchema.DUAL_INTENSITY, new LeafScanFile(unnamed).schema());
    }

    @Test
    void turnsHemiAzimuthHalfAround() throws Exception {
        String scanEncoder = String.valueOf(1.0 / (2 * Math.PI) * 25_600);
        String rotaryEncoder = String.valueOf(10.0 / 360 * 20_000);
        String row = "1," + scanEncoder + "," + rotaryEncoder + ",10.0,100,20.0,50,1.0";
        ScanReaderConfig untilted = ScanReaderConfig.defaults().withTransform(false);

        ScanRecord hemi = new LeafScanFile(write(HEMI_NAME, "# Firmware ver.: 4.11", row), untilted).records().get(0);
        assertEquals(Math.toRadians(190), hemi.azimuth(), EPSILON);
        assertEquals(Math.PI - 1.0, hemi.zenith(), EPSILON);

        ScanRecord hinge = new LeafScanFile(write(HINGE_NAME, "# Firmware ver.: 4.11", row), untilted).records().get(0);
        assertEquals(Math.toRadians(10), hinge.azimuth(), EPSILON);
    }

    @Test
    void appliesHeaderTilt() throws Exception {
        Path file = write(HINGE_NAME,
                "# Firmware ver.: 4.11",
                "# Tilt: 1024, 0, 0",
                "1,0,0,10.0,100,20.0,50,1.0");

        ScanRecord tilted = new LeafScanFile(file).records().get(0);
        assertEquals(Math.PI / 2, tilted.zenith(), EPSILON);
        assertEquals(Math.PI / 2, tilted.azimuth(), EPSILON);

        ScanRecord level = new LeafScanFile(file, ScanReaderConfig.defaults().withTransform(false)).records().get(0);
        assertEquals(Math.PI, level.zenith(), EPSILON);
        assertEquals(0, level.azimuth(), EPSILON);
        assertEquals(-10, level.return1().z(), EPSILON);
    }

    @Test
    void skipsZeroTiltVector() throws Exception {
        Path file = write(HINGE_NAME,
                "# Firmware ver.: 4.11",
                "# Tilt: (0, 0, 0)",
                "1,0,0,10.0,100,20.0,50,1.0");

        ScanRecord record = new LeafScanFile(file).records().get(0);

        assertEquals(Math.PI, record.zenith(), EPSILON);
        assertEquals(0, record.azimuth(), EPSILON);
        assertEquals(-10, record.return1().z(), EPSILON);
    }

    @Test
    void wrapsTinyNegativeAzimuthBelowFullTurn() throws Exception {
        Path file = write(HINGE_NAME,
                "# Firmware ver.: 4.11",
                "1,0,-1e-17,10.0,100,20.0,50,1.0");

        ScanRecord record = new LeafScanFile(file, ScanReaderConfig.defaults().withTransform(false)).records().get(0);

        assertTrue(record.azimuth() >= 0 && record.azimuth() < 2 * Math.PI, "azimuth " + record.azimuth());
        assertEquals(0, record.azimuth(), EPSILON);
    }

    @Test
    void keepsAnglesWithinPhysicalDomain() throws Exception {
        Random random = new Random(7);
        List<String> lines = new ArrayList<>(List.of("# Firmware ver.: 4.11", "# Tilt: (10, -20, 1020)"));
        for (int i = 0; i < 500; i++) {
            double scanEncoder = random.nextDouble() * 25_600 * 0.99;
            double rotaryEncoder = random.nextDouble() * 20_000;
            int intensity = random.nextInt(5);
            lines.add(i + "," + scanEncoder + "," + rotaryEncoder + ","
                    + random.nextDouble() * 200 + "," + intensity + ",-1," + intensity + ",0.5");
        }
        Path file = write(HEMI_NAME, lines.toArray(new String[0]));

        List<ScanRecord> records = new LeafScanFile(file).records();

        assertEquals(500, records.size());
        for (ScanRecord record : records) {
            assertTrue(record.zenith() >= 0 && record.zenith() <= Math.PI, "zenith " + record.zenith());
            assertTrue(record.azimuth() >= 0 && record.azimuth() < 2 * Math.PI, "azimuth " + record.azimuth());
            int expected = 2 - (Double.isNaN(record.range1()) ? 1 : 0) + (Double.isNaN(record.range2()) ? 1 : 0);
            assertEquals(expected, record.targetCount());
            if (!Double.isNaN(record.range1())) {
                assertTrue(record.range1() <= 120 && record.intensity1().getAsInt() > 0);
            }
            assertTrue(Double.isNaN(record.range2()));
        }
    }

    @Test
    void yieldsEmptyBatchForHeaderOnlyFile() throws Exception {
        LeafScanFile scan = new LeafScanFile(write(HEMI_NAME, "# Firmware ver.: 4.11", "# Tilt: (0, 0, 1024)"));

        assertTrue(scan.isEmpty());
        assertEquals(0, scan.truncatedRecordCount());
        assertEquals(2, scan.metadata().header().size());
    }

    @Test
    void parsesBodyWithoutFilenameIdentity() throws Exception {
        LeafScanFile scan = new LeafScanFile(write("scan.csv",
                "# Firmware ver.: 4.11",
                "1,6400,0,10.0,100,20.0,50,1.0"), ScanReaderConfig.defaults().withTransform(false));

        assertTrue(scan.metadata().identity().isEmpty());
        assertFalse(scan.metadata().scanType().map(type -> type == ScanType.HEMI).orElse(false));
        ScanRecord record = scan.records().get(0);
        assertTrue(record.timestamp().isEmpty());
        assertEquals(0, record.azimuth(), EPSILON);
        assertEquals(Math.PI / 2, record.zenith(), EPSILON);
    }

    @Test
    void propagatesMissingFile() {
        Path missing = Path.of("does-not-exist", HEMI_NAME);
        assertThrows(IOException.class, () -> new LeafScanFile(missing));
    }

    private static Path write(String name, String... lines) throws IOException {
        Path dir = Files.createTempDirectory("leaf-scan");
        Path file = dir.resolve(name);
        Files.write(file, List.of(lines));
        return file;
    }
}
