package com.phillippitts.visqol.service.model;

/**
 * Energy-based voice-activity rule.
 *
 * <p>A frame is active when its mean-square energy is at least {@code absoluteFloor} and within
 * {@code floorDb} of the loudest frame of the same buffer.
 *
 * @param enabled       whether silent frames are excluded from scoring
 * @param floorDb       maximum distance below the peak frame energy, in dB
 * @param absoluteFloor mean-square energy below which a frame is always silent
 */
public record VoiceActivitySettings(boolean enabled, double floorDb, double absoluteFloor) {

    public static VoiceActivitySettings disabled() {
        return new VoiceActivitySettings(false, 0.0, 0.0);
    }
}
