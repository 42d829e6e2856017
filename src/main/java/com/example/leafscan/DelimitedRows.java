package com.example.leafscan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Comma-delimited rows split to a fixed width. Rows whose trailing field is missing are
 * counted as truncated and dropped; rows wider than the schema are counted as oversized and
 * dropped. Short rows are padded with empty fields before the trailing-field test.
 */
public final class DelimitedRows {
    private final List<String[]> rows;
    private final int truncatedCount;
    private final int oversizedCount;

    private DelimitedRows(List<String[]> rows, int truncatedCount, int oversizedCount) {
        this.rows = Collections.unmodifiableList(rows);
        this.truncatedCount = truncatedCount;
        this.oversizedCount = oversizedCount;
    }

    /**
     * Splits each non-blank line into {@code width} stripped fields.
     *
     * @param missing decides whether a field holds no reading
     */
    public static DelimitedRows split(List<String> lines, int width, Predicate<String> missing) {
        List<String[]> rows = new ArrayList<>(lines.size());
        int truncated = 0;
        int oversized = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.split(",", -1);
            if (parts.length > width) {
                oversized++;
                continue;
            }
            String[] fields = new String[width];
            for (int i = 0; i < width; i++) {
                fields[i] = i < parts.length ? parts[i].strip() : "";
            }
            if (missing.test(fields[width - 1])) {
                truncated++;
                continue;
            }
            rows.add(fields);
        }
        return new DelimitedRows(rows, truncated, oversized);
    }

    public List<String[]> rows() {
        return rows;
    }

    public int truncatedCount() {
        return truncatedCount;
    }

    public int oversizedCount() {
        return oversizedCount;
    }
}
