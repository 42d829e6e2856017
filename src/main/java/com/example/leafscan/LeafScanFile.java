package com.example.leafscan;

import com.example.leafscan.metadata.ScanFileMetadata;
import com.example.leafscan.metadata.ScanMetadataParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A parsed LEAF scan file. Construction reads the file once, parses the header and footer,
 * then turns the data body into {@link ScanRecord}s. The result is immutable.
 */
public final class LeafScanFile {
    private final Path path;
    private final ScanReaderConfig config;
    private final ScanFileMetadata metadata;
    private final FirmwareSchema schema;
    private final List<ScanRecord> records;
    private final int truncatedRecordCount;
    private final int malformedRecordCount;

    public LeafScanFile(Path path) throws IOException {
        this(path, ScanReaderConfig.defaults());
    }

    public LeafScanFile(Path path, ScanReaderConfig config) throws IOException {
        this.path = path;
        this.config = config;
        List<String> lines = readLines(path);
        this.metadata = new ScanMetadataParser().parse(path, lines);

        List<String> dataLines = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (!line.startsWith(ScanMetadataParser.COMMENT_MARKER) && !line.isBlank()) {
                dataLines.add(line);
            }
        }
        ScanDataParser.ParsedBody body = new ScanDataParser(config).parse(path, metadata, dataLines);
        this.schema = body.schema();
        this.records = body.records();
        this.truncatedRecordCount = body.truncatedCount();
        this.malformedRecordCount = body.malformedCount();
    }

    private static List<String> readLines(Path path) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return lines;
    }

    public Path path() {
        return path;
    }

    public ScanReaderConfig config() {
        return config;
    }

    public ScanFileMetadata metadata() {
        return metadata;
    }

    public FirmwareSchema schema() {
        return schema;
    }

    public List<ScanRecord> records() {
        return records;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int truncatedRecordCount() {
        return truncatedRecordCount;
    }

    public int malformedRecordCount() {
        return malformedRecordCount;
    }
}
