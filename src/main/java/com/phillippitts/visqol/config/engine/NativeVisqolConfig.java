package com.phillippitts.visqol.config.engine;

import com.phillippitts.visqol.domain.QualityMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the high-fidelity native backend.
 * Binds to properties prefixed with "visqol.native".
 *
 * <p>Example application.properties:
 * <pre>
 * visqol.native.enabled=true
 * visqol.native.binary-path=tools/visqol/bazel-bin/visqol
 * visqol.native.audio-model-path=tools/visqol/model/libsvm_nu_svr_model.txt
 * visqol.native.speech-model-path=tools/visqol/model/lattice_tcditugenmeetpackhref_ls2_nl60_lr12_bs2048_learn.005_ep2400_train1_7_raw.tflite
 * visqol.native.timeout-seconds=120
 * visqol.native.max-stdout-bytes=1048576
 * </pre>
 *
 * @param enabled         whether the engine may select the native backend at all
 * @param binaryPath      path to the reference {@code visqol} executable
 * @param audioModelPath  similarity-to-quality model passed in AUDIO mode
 * @param speechModelPath similarity-to-quality model passed in SPEECH mode
 * @param timeoutSeconds  maximum run time of one native comparison
 * @param maxStdoutBytes  cap on captured stdout
 */
@ConfigurationProperties(prefix = "visqol.native")
@Validated
public record NativeVisqolConfig(
        @DefaultValue("true")
        boolean enabled,

        @NotNull(message = "Native binary path must not be null")
        @DefaultValue(DEFAULT_BINARY_PATH)
        String binaryPath,

        @NotNull(message = "Audio model path must not be null")
        @DefaultValue(DEFAULT_AUDIO_MODEL_PATH)
        String audioModelPath,

        @NotNull(message = "Speech model path must not be null")
        @DefaultValue(DEFAULT_SPEECH_MODEL_PATH)
        String speechModelPath,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("120")
        int timeoutSeconds,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("1048576")
        int maxStdoutBytes
) {

    public static final String DEFAULT_BINARY_PATH = "tools/visqol/bazel-bin/visqol";
    public static final String DEFAULT_AUDIO_MODEL_PATH = "tools/visqol/model/libsvm_nu_svr_model.txt";
    public static final String DEFAULT_SPEECH_MODEL_PATH =
            "tools/visqol/model/lattice_tcditugenmeetpackhref_ls2_nl60_lr12_bs2048_learn.005_ep2400_train1_7_raw.tflite";

    /**
     * Standard values: native backend enabled at the conventional build location, 2 minute timeout,
     * 1 MB stdout cap.
     */
    public static NativeVisqolConfig defaults() {
        return new NativeVisqolConfig(true, DEFAULT_BINARY_PATH, DEFAULT_AUDIO_MODEL_PATH,
                DEFAULT_SPEECH_MODEL_PATH, 120, 1_048_576);
    }

    /**
     * Configuration that never selects the native backend.
     */
    public static NativeVisqolConfig disabled() {
        return new NativeVisqolConfig(false, DEFAULT_BINARY_PATH, DEFAULT_AUDIO_MODEL_PATH,
                DEFAULT_SPEECH_MODEL_PATH, 120, 1_048_576);
    }

    /**
     * @return the model path configured for {@code mode}
     */
    public String modelPathFor(QualityMode mode) {
        return mode == QualityMode.SPEECH ? speechModelPath : audioModelPath;
    }
}
