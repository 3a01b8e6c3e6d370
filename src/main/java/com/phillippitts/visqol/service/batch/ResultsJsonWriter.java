package com.phillippitts.visqol.service.batch;

import com.phillippitts.visqol.domain.BatchOutcome;
import com.phillippitts.visqol.domain.MeasurementResult;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Debug export of measurements as JSON.
 *
 * <p>A single result is written as an object; a batch as an array of objects, with failed pairs
 * carrying {@code error_kind} and {@code error} instead of scores.
 */
public final class ResultsJsonWriter {

    private static final int INDENT = 2;

    private ResultsJsonWriter() {}

    public static JSONObject toJson(MeasurementResult result) {
        JSONObject obj = new JSONObject();
        obj.put("reference", result.referencePath() == null ? JSONObject.NULL : result.referencePath());
        obj.put("degraded", result.degradedPath() == null ? JSONObject.NULL : result.degradedPath());
        obj.put("moslqo", result.moslqo());
        obj.put("vnsim", result.vnsim());
        obj.put("fvnsim", new JSONArray(result.fvnsim()));
        obj.put("center_freq_bands", new JSONArray(result.centerFreqBands()));
        obj.put("backend", result.backendName());
        return obj;
    }

    public static JSONObject toJson(BatchOutcome outcome) {
        if (outcome.isSuccess()) {
            JSONObject obj = toJson(outcome.result());
            obj.put("reference", outcome.referenceId());
            obj.put("degraded", outcome.degradedId());
            return obj;
        }
        JSONObject obj = new JSONObject();
        obj.put("reference", outcome.referenceId());
        obj.put("degraded", outcome.degradedId());
        obj.put("error_kind", outcome.errorKind().name());
        obj.put("error", outcome.errorMessage() == null ? JSONObject.NULL : outcome.errorMessage());
        return obj;
    }

    public static void write(MeasurementResult result, Path file) {
        writeString(toJson(result).toString(INDENT), file);
    }

    public static void write(List<BatchOutcome> outcomes, Path file) {
        JSONArray array = new JSONArray();
        for (BatchOutcome outcome : outcomes) {
            array.put(toJson(outcome));
        }
        writeString(array.toString(INDENT), file);
    }

    private static void writeString(String content, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON results: " + file, e);
        }
    }
}
