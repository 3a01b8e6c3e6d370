package com.phillippitts.visqol.service.batch;

import com.phillippitts.visqol.domain.BatchOutcome;
import com.phillippitts.visqol.domain.MeasurementResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes batch outcomes as {@code reference,degraded,moslqo,vnsim,status,error}.
 *
 * <p>{@code status} is {@code ok} or the failure's error kind; score cells are empty for
 * failures. Rows follow batch order.
 */
public final class ResultsCsvWriter {

    private static final Logger LOG = LogManager.getLogger(ResultsCsvWriter.class);

    static final String HEADER = "reference,degraded,moslqo,vnsim,status,error";
    static final String STATUS_OK = "ok";

    private ResultsCsvWriter() {}

    /**
     * @throws UncheckedIOException if the file cannot be written
     */
    public static void write(List<BatchOutcome> outcomes, Path csv) {
        try {
            Path parent = csv.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter w = Files.newBufferedWriter(csv, StandardCharsets.UTF_8)) {
                w.write(HEADER);
                w.newLine();
                for (BatchOutcome outcome : outcomes) {
                    w.write(row(outcome));
                    w.newLine();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write results CSV: " + csv, e);
        }
        LOG.info("Wrote {} result row(s) to {}", outcomes.size(), csv);
    }

    static String row(BatchOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append(CsvLines.quote(outcome.referenceId())).append(',')
                .append(CsvLines.quote(outcome.degradedId())).append(',');
        if (outcome.isSuccess()) {
            MeasurementResult r = outcome.result();
            sb.append(r.moslqo()).append(',').append(r.vnsim()).append(',')
                    .append(STATUS_OK).append(',');
        } else {
            sb.append(",,").append(outcome.errorKind().name()).append(',')
                    .append(CsvLines.quote(outcome.errorMessage()));
        }
        return sb.toString();
    }
}
