package com.phillippitts.visqol.service.model;

import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.ModelLoadException;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelRepositoryTest {

    private final ModelRepository repository = new ModelRepository();

    @TempDir
    Path tmp;

    @Test
    void shouldLoadBundledAudioModel() {
        ModeModel model = repository.load(QualityMode.AUDIO);

        assertThat(model.id()).isEqualTo("visqol-audio-v1");
        assertThat(model.sampleRate()).isEqualTo(48_000);
        assertThat(model.bandCount()).isEqualTo(32);
        assertThat(model.voiceActivity().enabled()).isFalse();
        assertThat(model.hasBandWeights()).isFalse();
        assertThat(model.mapping()).isInstanceOf(PolynomialMapping.class);
        assertThat(model.mapping().map(1.0)).isCloseTo(4.73, within(1e-9));
    }

    @Test
    void shouldLoadBundledSpeechModel() {
        ModeModel model = repository.load(QualityMode.SPEECH);

        assertThat(model.id()).isEqualTo("visqol-speech-v1");
        assertThat(model.windowSize()).isEqualTo(512);
        assertThat(model.voiceActivity().enabled()).isTrue();
        assertThat(model.voiceActivity().floorDb()).isEqualTo(40.0);
        assertThat(model.mapping()).isInstanceOf(LogisticMapping.class);
        assertThat(model.mapping().map(1.0)).isCloseTo(4.9586, within(1e-3));
    }

    @Test
    void externalDirectoryShouldOverrideClasspath() throws IOException {
        JSONObject json = speechJson();
        json.put("version", "v1-tuned");
        json.getJSONObject("bands").put("count", 10);
        Files.writeString(tmp.resolve("visqol-speech-v1.json"), json.toString());

        ModeModel model = new ModelRepository(tmp).load(QualityMode.SPEECH);

        assertThat(model.version()).isEqualTo("v1-tuned");
        assertThat(model.bandCount()).isEqualTo(10);
    }

    @Test
    void externalDirectoryShouldFallBackToClasspathWhenFileAbsent() {
        ModeModel model = new ModelRepository(tmp).load(QualityMode.AUDIO);

        assertThat(model.version()).isEqualTo("v1");
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> ModelRepository.parse("{not json", QualityMode.AUDIO, "broken.json"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("broken.json")
                .hasMessageContaining("malformed model");
    }

    @Test
    void shouldRejectMissingSection() {
        JSONObject json = speechJson();
        json.remove("patch");

        assertThatThrownBy(() -> parse(json))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("patch");
    }

    @Test
    void shouldRejectModeMismatch() {
        assertThatThrownBy(() -> ModelRepository.parse(speechJson().toString(), QualityMode.AUDIO, "x.json"))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("declares mode 'speech', expected 'audio'");
    }

    @Test
    void shouldRejectInvalidFraming() {
        assertInvalid(j -> j.getJSONObject("spectral").put("windowSize", 500), "power of two");
        assertInvalid(j -> j.getJSONObject("spectral").put("hopSize", 1024), "hopSize");
        assertInvalid(j -> j.getJSONObject("bands").put("maxFrequency", 9000), "band range");
        assertInvalid(j -> j.getJSONObject("bands").put("count", 0), "band count");
        assertInvalid(j -> j.getJSONObject("patch").put("stride", 0), "patch frames and stride");
        assertInvalid(j -> j.put("dynamicRangeDb", -3), "dynamicRangeDb");
    }

    @Test
    void shouldValidateBandWeights() {
        assertInvalid(j -> j.getJSONObject("bands").put("weights", new JSONArray(new double[] {1, 2})),
                "expected 21 band weights");
        assertInvalid(j -> j.getJSONObject("bands").put("weights", new JSONArray(new double[21])),
                "must not all be zero");

        JSONObject json = speechJson();
        double[] weights = new double[21];
        weights[3] = 2.0;
        json.getJSONObject("bands").put("weights", new JSONArray(weights));
        assertThat(parse(json).bandWeights()).containsExactly(weights);
    }

    @Test
    void shouldRejectNonMonotoneMapping() {
        assertInvalid(j -> j.put("mapping", new JSONObject()
                        .put("type", "polynomial")
                        .put("coefficients", new JSONArray(new double[] {5.0, -4.0}))),
                "not monotone");
        assertInvalid(j -> j.getJSONObject("mapping").put("slope", -12.0), "not monotone");
        assertInvalid(j -> j.getJSONObject("mapping").put("type", "spline"), "unknown mapping type 'spline'");
    }

    @Test
    void missingVoiceActivityShouldMeanDisabled() {
        JSONObject json = speechJson();
        json.remove("voiceActivity");

        assertThat(parse(json).voiceActivity().enabled()).isFalse();
    }

    private static void assertInvalid(Consumer<JSONObject> mutation, String message) {
        JSONObject json = speechJson();
        mutation.accept(json);
        assertThatThrownBy(() -> parse(json))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining(message);
    }

    private static ModeModel parse(JSONObject json) {
        return ModelRepository.parse(json.toString(), QualityMode.SPEECH, "test-model.json");
    }

    private static JSONObject speechJson() {
        return new JSONObject()
                .put("version", "v1")
                .put("mode", "speech")
                .put("spectral", new JSONObject().put("windowSize", 512).put("hopSize", 256))
                .put("bands", new JSONObject().put("count", 21).put("minFrequency", 150.0).put("maxFrequency", 7500.0))
                .put("patch", new JSONObject().put("frames", 20).put("stride", 10))
                .put("dynamicRangeDb", 50.0)
                .put("voiceActivity", new JSONObject().put("enabled", true).put("floorDb", 40.0)
                        .put("absoluteFloor", 1e-10))
                .put("mapping", new JSONObject().put("type", "logistic").put("lower", 1.0).put("upper", 5.0)
                        .put("slope", 12.0).put("midpoint", 0.62));
    }
}
