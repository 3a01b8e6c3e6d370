package com.phillippitts.visqol.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QualityModeTest {

    @Test
    void modesShouldFixWorkingRates() {
        assertThat(QualityMode.AUDIO.sampleRate()).isEqualTo(48_000);
        assertThat(QualityMode.SPEECH.sampleRate()).isEqualTo(16_000);
        assertThat(QualityMode.SPEECH.usesVoiceActivity()).isTrue();
        assertThat(QualityMode.AUDIO.usesVoiceActivity()).isFalse();
    }

    @Test
    void modelFileNameShouldBeVersioned() {
        assertThat(QualityMode.AUDIO.modelFileName()).isEqualTo("visqol-audio-v1.json");
        assertThat(QualityMode.SPEECH.modelFileName()).isEqualTo("visqol-speech-v1.json");
    }

    @Test
    void fromStringShouldBeCaseInsensitive() {
        assertThat(QualityMode.fromString(" Speech ")).isEqualTo(QualityMode.SPEECH);
        assertThat(QualityMode.fromString("AUDIO")).isEqualTo(QualityMode.AUDIO);
        assertThatThrownBy(() -> QualityMode.fromString("music"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("music");
    }
}
