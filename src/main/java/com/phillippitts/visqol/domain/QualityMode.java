package com.phillippitts.visqol.domain;

import java.util.Locale;

/**
 * Measurement mode. Fixes the working sample rate and selects the model resource.
 */
public enum QualityMode {

    /** Full-band audio at 48 kHz. */
    AUDIO(48_000, "audio"),

    /** Wideband speech at 16 kHz with voice-activity filtering. */
    SPEECH(16_000, "speech");

    private static final String MODEL_VERSION = "v1";

    private final int sampleRate;
    private final String id;

    QualityMode(int sampleRate, String id) {
        this.sampleRate = sampleRate;
        this.id = id;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public String id() {
        return id;
    }

    /**
     * @return file name of this mode's versioned model, e.g. {@code visqol-audio-v1.json}
     */
    public String modelFileName() {
        return "visqol-" + id + "-" + MODEL_VERSION + ".json";
    }

    public boolean usesVoiceActivity() {
        return this == SPEECH;
    }

    /**
     * Parses a mode name case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static QualityMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Quality mode must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QualityMode mode : values()) {
            if (mode.id.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown quality mode: " + value);
    }
}
