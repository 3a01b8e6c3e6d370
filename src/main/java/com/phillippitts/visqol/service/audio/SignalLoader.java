package com.phillippitts.visqol.service.audio;

import com.phillippitts.visqol.domain.AudioInput;
import com.phillippitts.visqol.domain.QualityMode;
import com.phillippitts.visqol.exception.DecodeException;
import com.phillippitts.visqol.exception.InvalidInputException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Turns any supported input into a mono {@link AudioBuffer}.
 *
 * <p>Files are decoded by {@link WavDecoder}; in-memory samples are checked for emptiness, equal
 * channel lengths and finiteness. Multi-channel audio is downmixed by the arithmetic mean of the
 * channels. In-memory samples without an explicit rate are assigned the mode's working rate.
 *
 * <p>Stateless and thread-safe.
 */
public final class SignalLoader {

    private static final Logger LOG = LogManager.getLogger(SignalLoader.class);

    /**
     * @param input any object accepted by {@link AudioInput#from(Object)}
     * @throws InvalidInputException for unsupported types or bad samples
     * @throws DecodeException for unreadable files
     */
    public AudioBuffer load(Object input, QualityMode mode) {
        return load(AudioInput.from(input), mode);
    }

    public AudioBuffer load(AudioInput input, QualityMode mode) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (input.isPath()) {
            return loadPath(input.path());
        }
        int rate = input.sampleRate().orElse(mode.sampleRate());
        return fromChannels(input.channels(), rate);
    }

    private AudioBuffer loadPath(Path path) {
        String source = path.toString();
        if (!Files.isRegularFile(path)) {
            throw new DecodeException(source, "file not found");
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new DecodeException(source, "read failed: " + e.getMessage(), e);
        }
        DecodedAudio decoded = WavDecoder.decode(bytes, source);
        AudioBuffer buffer = new AudioBuffer(downmix(decoded.channels()), decoded.sampleRate());
        LOG.debug("Loaded {}: {} samples at {} Hz ({} channel(s))",
                source, buffer.length(), buffer.sampleRate(), decoded.channels().length);
        return buffer;
    }

    private AudioBuffer fromChannels(double[][] channels, int rate) {
        if (channels.length == 0) {
            throw new InvalidInputException("array", "no channels");
        }
        int length = channels[0].length;
        for (int c = 0; c < channels.length; c++) {
            if (channels[c].length != length) {
                throw new InvalidInputException("array", "channel " + c + " has " + channels[c].length
                        + " samples, expected " + length);
            }
        }
        if (length == 0) {
            throw new InvalidInputException("array", "empty sample array");
        }
        for (int c = 0; c < channels.length; c++) {
            for (int i = 0; i < length; i++) {
                if (!Double.isFinite(channels[c][i])) {
                    throw new InvalidInputException("array", "non-finite sample at channel " + c
                            + ", index " + i);
                }
            }
        }
        return new AudioBuffer(downmix(channels), rate);
    }

    /**
     * Arithmetic mean across channels; a single channel is returned as-is.
     */
    static double[] downmix(double[][] channels) {
        if (channels.length == 1) {
            return channels[0];
        }
        int length = channels[0].length;
        double[] mono = new double[length];
        for (double[] channel : channels) {
            for (int i = 0; i < length; i++) {
                mono[i] += channel[i];
            }
        }
        for (int i = 0; i < length; i++) {
            mono[i] /= channels.length;
        }
        return mono;
    }
}
