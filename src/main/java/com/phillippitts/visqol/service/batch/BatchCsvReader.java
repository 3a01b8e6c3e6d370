package com.phillippitts.visqol.service.batch;

import com.phillippitts.visqol.domain.MeasurementPair;
import com.phillippitts.visqol.exception.DecodeException;
import com.phillippitts.visqol.exception.InvalidInputException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a batch pair list.
 *
 * <p>Format: a header row naming the {@code reference} and {@code degraded} columns (any order,
 * case-insensitive, extra columns ignored) followed by one pair per row. Rows with a blank
 * reference or degraded cell are skipped with a warning. Relative paths are resolved against the
 * CSV's directory when the file exists there, otherwise left as given.
 */
public final class BatchCsvReader {

    private static final Logger LOG = LogManager.getLogger(BatchCsvReader.class);

    static final String REFERENCE_COLUMN = "reference";
    static final String DEGRADED_COLUMN = "degraded";

    private BatchCsvReader() {}

    /**
     * @throws DecodeException if the file cannot be read
     * @throws InvalidInputException if the header is missing a column or no valid pair remains
     */
    public static List<MeasurementPair> read(Path csv) {
        String source = csv.toString();
        if (!Files.isRegularFile(csv)) {
            throw new DecodeException(source, "batch file not found");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DecodeException(source, "read failed: " + e.getMessage(), e);
        }
        return parse(lines, source, csv.toAbsolutePath().getParent());
    }

    // Visible for tests
    static List<MeasurementPair> parse(List<String> lines, String source, Path baseDir) {
        int headerIndex = firstNonBlank(lines);
        if (headerIndex < 0) {
            throw new InvalidInputException(source, "batch file is empty");
        }
        List<String> header = CsvLines.split(stripBom(lines.get(headerIndex)));
        int refCol = indexOf(header, REFERENCE_COLUMN);
        int degCol = indexOf(header, DEGRADED_COLUMN);
        if (refCol < 0 || degCol < 0) {
            throw new InvalidInputException(source, "header must contain '" + REFERENCE_COLUMN
                    + "' and '" + DEGRADED_COLUMN + "' columns, got " + header);
        }

        List<MeasurementPair> pairs = new ArrayList<>();
        for (int i = headerIndex + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = CsvLines.split(line);
            String ref = field(fields, refCol);
            String deg = field(fields, degCol);
            if (ref.isEmpty() || deg.isEmpty()) {
                LOG.warn("Skipping row {} of {}: blank reference or degraded cell", i + 1, source);
                continue;
            }
            pairs.add(MeasurementPair.of(resolve(ref, baseDir), resolve(deg, baseDir)));
        }
        if (pairs.isEmpty()) {
            throw new InvalidInputException(source, "no valid reference/degraded pairs");
        }
        LOG.info("Read {} pair(s) from {}", pairs.size(), source);
        return pairs;
    }

    private static int firstNonBlank(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                return i;
            }
        }
        return -1;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    private static int indexOf(List<String> header, String column) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).toLowerCase(Locale.ROOT).equals(column)) {
                return i;
            }
        }
        return -1;
    }

    private static String field(List<String> fields, int index) {
        return index < fields.size() ? fields.get(index) : "";
    }

    private static Path resolve(String value, Path baseDir) {
        Path path = Path.of(value);
        if (path.isAbsolute() || baseDir == null) {
            return path;
        }
        Path relative = baseDir.resolve(path);
        return Files.exists(relative) ? relative : path;
    }
}
