package com.phillippitts.visqol.service.analysis;

import com.phillippitts.visqol.exception.InvalidInputException;
import com.phillippitts.visqol.service.audio.AudioBuffer;
import com.phillippitts.visqol.service.model.ModeModel;

/**
 * Short-time spectral analysis into perceptual bands.
 *
 * <p>Frames of {@code windowSize} samples are taken every {@code hopSize} samples, Hann-windowed and
 * transformed. Power is normalised by the window energy, integrated into the model's gammatone
 * bands and converted to dB. The last frame is zero-padded, so any non-empty buffer yields at
 * least one frame and the frame count depends only on the buffer length and the model.
 *
 * <p>Thread-safe; one instance per model.
 */
public final class SpectralAnalyzer {

    /** Added to band energies before the log so digital silence stays finite (-120 dB). */
    static final double ENERGY_EPSILON = 1e-12;

    private final ModeModel model;
    private final FrequencyBandLayout layout;
    private final VoiceActivityDetector vad;
    private final double[] window;
    private final double windowEnergy;

    public SpectralAnalyzer(ModeModel model) {
        this.model = model;
        this.layout = FrequencyBandLayout.create(model.bandCount(), model.minFrequency(), model.maxFrequency(),
                model.windowSize(), model.sampleRate());
        this.vad = new VoiceActivityDetector(model.voiceActivity());
        this.window = hann(model.windowSize());
        double e = 0.0;
        for (double w : window) {
            e += w * w;
        }
        this.windowEnergy = e;
    }

    /**
     * @throws InvalidInputException if the buffer is empty or not at the model's rate
     */
    public Spectrogram analyze(AudioBuffer buffer) {
        if (buffer.isEmpty()) {
            throw new InvalidInputException("cannot analyze an empty buffer");
        }
        if (buffer.sampleRate() != model.sampleRate()) {
            throw new InvalidInputException("buffer is at " + buffer.sampleRate() + " Hz, model expects "
                    + model.sampleRate() + " Hz");
        }
        double[] samples = buffer.samples();
        int frames = frameCount(samples.length);
        int size = model.windowSize();
        int hop = model.hopSize();

        double[][] values = new double[frames][];
        double[] energies = new double[frames];
        double[] frame = new double[size];
        for (int f = 0; f < frames; f++) {
            int start = f * hop;
            double sumSquares = 0.0;
            for (int i = 0; i < size; i++) {
                int idx = start + i;
                double s = idx < samples.length ? samples[idx] : 0.0;
                sumSquares += s * s;
                frame[i] = s * window[i];
            }
            energies[f] = sumSquares / size;

            double[] power = Fft.powerSpectrum(frame);
            for (int k = 0; k < power.length; k++) {
                power[k] /= windowEnergy;
            }
            double[] bandEnergy = layout.integrate(power);
            double[] db = new double[bandEnergy.length];
            for (int b = 0; b < db.length; b++) {
                db[b] = 10.0 * Math.log10(bandEnergy[b] + ENERGY_EPSILON);
            }
            values[f] = db;
        }
        return new Spectrogram(values, vad.detect(energies), layout.centreFrequencies());
    }

    /**
     * @return number of frames produced for a buffer of {@code length} samples
     */
    public int frameCount(int length) {
        int size = model.windowSize();
        if (length <= size) {
            return 1;
        }
        int hop = model.hopSize();
        return 1 + (length - size + hop - 1) / hop;
    }

    public double[] centreFrequencies() {
        return layout.centreFrequencies();
    }

    public ModeModel model() {
        return model;
    }

    static double[] hann(int size) {
        double[] w = new double[size];
        for (int i = 0; i < size; i++) {
            w[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / size);
        }
        return w;
    }
}
