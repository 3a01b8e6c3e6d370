package com.phillippitts.visqol.service.backend.visqolcli;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the native binary's results.
 *
 * <p>The debug JSON ({@code --output_debug}) is the primary source and carries {@code moslqo},
 * {@code vnsim}, {@code fvnsim} and {@code center_freq_bands}. When it is missing, the console
 * summary ({@code MOS-LQO: 4.12}) yields the score alone. Malformed input yields empty results
 * rather than exceptions; the caller decides what is fatal.
 */
final class NativeVisqolOutputParser {

    private static final Pattern MOS_LINE = Pattern.compile("MOS-LQO:\\s*([-+0-9.eE]+)");

    private NativeVisqolOutputParser() {}

    /**
     * Parsed native output.
     */
    record NativeOutput(double moslqo, double vnsim, double[] fvnsim, double[] centerFreqBands) {
    }

    static Optional<NativeOutput> parseDebugJson(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (!obj.has("moslqo")) {
                return Optional.empty();
            }
            double moslqo = obj.getDouble("moslqo");
            double vnsim = obj.optDouble("vnsim", Double.NaN);
            double[] fvnsim = toArray(obj.optJSONArray("fvnsim"));
            double[] bands = toArray(obj.optJSONArray("center_freq_bands"));
            if (Double.isNaN(vnsim) || fvnsim.length == 0 || fvnsim.length != bands.length) {
                return Optional.empty();
            }
            return Optional.of(new NativeOutput(moslqo, vnsim, fvnsim, bands));
        } catch (JSONException e) {
            return Optional.empty();
        }
    }

    /**
     * @return MOS-LQO printed on the console, if any
     */
    static Optional<Double> parseConsoleMos(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return Optional.empty();
        }
        Matcher m = MOS_LINE.matcher(stdout);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(m.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static double[] toArray(JSONArray array) {
        if (array == null) {
            return new double[0];
        }
        double[] out = new double[array.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = array.optDouble(i, Double.NaN);
        }
        return out;
    }
}
