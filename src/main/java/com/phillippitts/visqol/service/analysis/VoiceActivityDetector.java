package com.phillippitts.visqol.service.analysis;

import com.phillippitts.visqol.service.model.VoiceActivitySettings;

import java.util.Arrays;

/**
 * Marks frames as active or silent from their mean-square energy.
 *
 * <p>A frame is active when its energy is at least the absolute floor and no more than
 * {@code floorDb} below the buffer's loudest frame. If even the loudest frame is under the absolute
 * floor, every frame is silent. With voice activity disabled every frame is active.
 */
public final class VoiceActivityDetector {

    private final VoiceActivitySettings settings;

    public VoiceActivityDetector(VoiceActivitySettings settings) {
        this.settings = settings;
    }

    /**
     * @param frameEnergies mean-square energy per frame
     * @return activity flag per frame
     */
    public boolean[] detect(double[] frameEnergies) {
        boolean[] active = new boolean[frameEnergies.length];
        if (!settings.enabled()) {
            Arrays.fill(active, true);
            return active;
        }
        double peak = 0.0;
        for (double e : frameEnergies) {
            peak = Math.max(peak, e);
        }
        if (peak < settings.absoluteFloor() || peak <= 0.0) {
            return active;
        }
        double relativeFloor = peak * Math.pow(10.0, -settings.floorDb() / 10.0);
        double threshold = Math.max(relativeFloor, settings.absoluteFloor());
        for (int f = 0; f < frameEnergies.length; f++) {
            active[f] = frameEnergies[f] >= threshold;
        }
        return active;
    }
}
