package com.phillippitts.visqol.service.model;

import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.ModelLoadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads and validates per-mode model resources.
 *
 * <p>Resources are looked up by file name ({@link QualityMode#modelFileName()}) in an optional
 * external directory first, then on the classpath under {@code model/}. Every structural problem
 * (missing file, malformed JSON, out-of-range value, non-monotone mapping) is reported as a
 * {@link ModelLoadException}.
 *
 * <p><b>Resource layout:</b>
 * <pre>
 * {
 *   "version": "v1", "mode": "speech",
 *   "spectral": {"windowSize": 512, "hopSize": 256},
 *   "bands": {"count": 21, "minFrequency": 150, "maxFrequency": 7500, "weights": [...]},
 *   "patch": {"frames": 20, "stride": 10},
 *   "dynamicRangeDb": 50,
 *   "voiceActivity": {"enabled": true, "floorDb": 40, "absoluteFloor": 1e-10},
 *   "mapping": {"type": "logistic", "lower": 1, "upper": 5, "slope": 12, "midpoint": 0.62}
 * }
 * </pre>
 * {@code weights} and {@code voiceActivity} are optional.
 */
public class ModelRepository {

    private static final Logger LOG = LogManager.getLogger(ModelRepository.class);

    static final String CLASSPATH_PREFIX = "model/";
    private static final int MONOTONICITY_STEPS = 1000;
    private static final int MIN_WINDOW_SIZE = 16;

    private final Path externalDirectory;

    /**
     * Loads models from the classpath only.
     */
    public ModelRepository() {
        this(null);
    }

    /**
     * @param externalDirectory directory searched before the classpath, may be null
     */
    public ModelRepository(Path externalDirectory) {
        this.externalDirectory = externalDirectory;
    }

    /**
     * @throws ModelLoadException if the resource is missing, unparsable or invalid
     */
    public ModeModel load(QualityMode mode) {
        String fileName = mode.modelFileName();
        String json = read(fileName);
        ModeModel model = parse(json, mode, fileName);
        LOG.info("Loaded quality model {}: window={}, hop={}, bands={} ({}-{} Hz), patch={}/{}, mapping={}",
                model.id(), model.windowSize(), model.hopSize(), model.bandCount(),
                model.minFrequency(), model.maxFrequency(), model.patchFrames(), model.patchStride(),
                model.mapping().type());
        return model;
    }

    private String read(String fileName) {
        if (externalDirectory != null) {
            Path candidate = externalDirectory.resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                try {
                    return Files.readString(candidate, StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new ModelLoadException(candidate.toString(), "read failed", e);
                }
            }
            LOG.debug("Model {} not found in {}, falling back to classpath", fileName, externalDirectory);
        }
        String resource = CLASSPATH_PREFIX + fileName;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = ModelRepository.class.getClassLoader();
        }
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ModelLoadException(resource, "resource not found");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ModelLoadException(resource, "read failed", e);
        }
    }

    // Visible for tests
    static ModeModel parse(String json, QualityMode mode, String source) {
        try {
            JSONObject root = new JSONObject(json);

            String version = root.getString("version");
            if (version.isBlank()) {
                throw new ModelLoadException(source, "version must not be blank");
            }
            String declaredMode = root.getString("mode");
            if (!mode.id().equals(declaredMode.toLowerCase(Locale.ROOT))) {
                throw new ModelLoadException(source, "declares mode '" + declaredMode + "', expected '" + mode.id() + "'");
            }

            JSONObject spectral = root.getJSONObject("spectral");
            int windowSize = spectral.getInt("windowSize");
            int hopSize = spectral.getInt("hopSize");
            if (windowSize < MIN_WINDOW_SIZE || Integer.bitCount(windowSize) != 1) {
                throw new ModelLoadException(source, "windowSize must be a power of two >= " + MIN_WINDOW_SIZE
                        + ", got " + windowSize);
            }
            if (hopSize <= 0 || hopSize > windowSize) {
                throw new ModelLoadException(source, "hopSize must be in (0, windowSize], got " + hopSize);
            }

            JSONObject bands = root.getJSONObject("bands");
            int bandCount = bands.getInt("count");
            double minFrequency = bands.getDouble("minFrequency");
            double maxFrequency = bands.getDouble("maxFrequency");
            double nyquist = mode.sampleRate() / 2.0;
            if (bandCount <= 0) {
                throw new ModelLoadException(source, "band count must be positive, got " + bandCount);
            }
            if (!(minFrequency > 0 && minFrequency < maxFrequency && maxFrequency < nyquist)) {
                throw new ModelLoadException(source, "band range must satisfy 0 < min < max < " + nyquist
                        + ", got " + minFrequency + "-" + maxFrequency);
            }
            double[] weights = parseWeights(bands.optJSONArray("weights"), bandCount, source);

            JSONObject patch = root.getJSONObject("patch");
            int patchFrames = patch.getInt("frames");
            int patchStride = patch.getInt("stride");
            if (patchFrames <= 0 || patchStride <= 0) {
                throw new ModelLoadException(source, "patch frames and stride must be positive");
            }

            double dynamicRangeDb = root.getDouble("dynamicRangeDb");
            if (!(dynamicRangeDb > 0) || !Double.isFinite(dynamicRangeDb)) {
                throw new ModelLoadException(source, "dynamicRangeDb must be positive, got " + dynamicRangeDb);
            }

            VoiceActivitySettings vad = parseVoiceActivity(root.optJSONObject("voiceActivity"), source);
            QualityMapping mapping = parseMapping(root.getJSONObject("mapping"), source);
            if (!mapping.isMonotone(MONOTONICITY_STEPS)) {
                throw new ModelLoadException(source, "mapping is not monotone increasing on [0, 1]: " + mapping);
            }

            return new ModeModel(version, mode, windowSize, hopSize, bandCount, minFrequency, maxFrequency,
                    weights, patchFrames, patchStride, dynamicRangeDb, vad, mapping);
        } catch (JSONException e) {
            throw new ModelLoadException(source, "malformed model: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ModelLoadException(source, e.getMessage(), e);
        }
    }

    private static double[] parseWeights(JSONArray array, int bandCount, String source) {
        if (array == null) {
            return null;
        }
        if (array.length() != bandCount) {
            throw new ModelLoadException(source, "expected " + bandCount + " band weights, got " + array.length());
        }
        double[] weights = new double[bandCount];
        double sum = 0.0;
        for (int i = 0; i < bandCount; i++) {
            weights[i] = array.getDouble(i);
            if (!(weights[i] >= 0) || !Double.isFinite(weights[i])) {
                throw new ModelLoadException(source, "band weight " + i + " must be >= 0, got " + weights[i]);
            }
            sum += weights[i];
        }
        if (sum <= 0) {
            throw new ModelLoadException(source, "band weights must not all be zero");
        }
        return weights;
    }

    private static VoiceActivitySettings parseVoiceActivity(JSONObject vad, String source) {
        if (vad == null || !vad.optBoolean("enabled", false)) {
            return VoiceActivitySettings.disabled();
        }
        double floorDb = vad.getDouble("floorDb");
        double absoluteFloor = vad.getDouble("absoluteFloor");
        if (!(floorDb > 0) || !(absoluteFloor >= 0)) {
            throw new ModelLoadException(source, "voiceActivity needs floorDb > 0 and absoluteFloor >= 0");
        }
        return new VoiceActivitySettings(true, floorDb, absoluteFloor);
    }

    private static QualityMapping parseMapping(JSONObject mapping, String source) {
        String type = mapping.getString("type").toLowerCase(Locale.ROOT);
        switch (type) {
            case "polynomial": {
                JSONArray array = mapping.getJSONArray("coefficients");
                double[] coefficients = new double[array.length()];
                for (int i = 0; i < coefficients.length; i++) {
                    coefficients[i] = array.getDouble(i);
                }
                return new PolynomialMapping(coefficients);
            }
            case "logistic":
                return new LogisticMapping(
                        mapping.getDouble("lower"),
                        mapping.getDouble("upper"),
                        mapping.getDouble("slope"),
                        mapping.getDouble("midpoint"));
            default:
                throw new ModelLoadException(source, "unknown mapping type '" + type + "'");
        }
    }
}
