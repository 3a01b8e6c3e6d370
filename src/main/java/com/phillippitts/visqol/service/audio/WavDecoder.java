package com.phillippitts.visqol.service.audio;

import com.phillippitts.visqol.exception.DecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Decodes audio containers into channel-major double samples in [-1, 1].
 *
 * <p>RIFF/WAVE is parsed directly: integer PCM at 8 (unsigned), 16, 24 and 32 bits, IEEE float at
 * 32 and 64 bits, and WAVE_FORMAT_EXTENSIBLE wrapping either. The chunk walk tolerates extra chunks
 * (LIST, fact, ...) and extended fmt chunks, and honours the even-byte padding of odd-sized chunks.
 * Anything that is not RIFF/WAVE is handed to Java Sound (AIFF, AU).
 */
final class WavDecoder {

    private static final Logger LOG = LogManager.getLogger(WavDecoder.class);

    private WavDecoder() {
    }

    /**
     * @param bytes  container bytes
     * @param source file name used in error messages
     * @throws DecodeException if the container is corrupt or its encoding unsupported
     */
    static DecodedAudio decode(byte[] bytes, String source) {
        if (isWav(bytes)) {
            return decodeWav(bytes, source);
        }
        return decodeWithJavaSound(bytes, source);
    }

    static boolean isWav(byte[] a) {
        return a.length >= WavFormat.RIFF_HEADER_SIZE
                && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
                && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }

    private static DecodedAudio decodeWav(byte[] wav, String source) {
        WavChunks chunks = parseWavChunks(wav, source);
        if (chunks.fmtOffset == -1) {
            throw new DecodeException(source, "missing fmt chunk");
        }
        if (chunks.dataOffset == -1) {
            throw new DecodeException(source, "missing data chunk");
        }
        if (chunks.fmtSize < WavFormat.FMT_CHUNK_MIN_SIZE) {
            throw new DecodeException(source, "fmt chunk too small: " + chunks.fmtSize + " bytes");
        }

        int off = chunks.fmtOffset;
        int formatTag = readLEShort(wav, off);
        int channels = readLEShort(wav, off + 2);
        int sampleRate = readLEInt(wav, off + 4);
        int blockAlign = readLEShort(wav, off + 12);
        int bitsPerSample = readLEShort(wav, off + 14);

        if (formatTag == WavFormat.AUDIO_FORMAT_EXTENSIBLE) {
            if (chunks.fmtSize < WavFormat.EXTENSIBLE_FMT_SIZE) {
                throw new DecodeException(source, "extensible fmt chunk too small: " + chunks.fmtSize);
            }
            formatTag = readLEShort(wav, off + WavFormat.EXTENSIBLE_SUBFORMAT_OFFSET);
        }
        if (channels <= 0) {
            throw new DecodeException(source, "invalid channel count: " + channels);
        }
        if (sampleRate <= 0) {
            throw new DecodeException(source, "invalid sample rate: " + sampleRate);
        }
        int bytesPerSample = bitsPerSample / 8;
        if (bitsPerSample % 8 != 0 || bytesPerSample == 0 || blockAlign != channels * bytesPerSample) {
            throw new DecodeException(source, "inconsistent block layout: bits=" + bitsPerSample
                    + ", channels=" + channels + ", blockAlign=" + blockAlign);
        }
        SampleReader reader = readerFor(formatTag, bitsPerSample, source);

        int frames = chunks.dataSize / blockAlign;
        double[][] out = new double[channels][frames];
        int pos = chunks.dataOffset;
        for (int i = 0; i < frames; i++) {
            for (int c = 0; c < channels; c++) {
                out[c][i] = reader.read(wav, pos);
                pos += bytesPerSample;
            }
        }
        LOG.debug("Decoded WAV {}: format={}, channels={}, rate={}, bits={}, frames={}",
                source, formatTag, channels, sampleRate, bitsPerSample, frames);
        return new DecodedAudio(out, sampleRate);
    }

    private static WavChunks parseWavChunks(byte[] wav, String source) {
        int offset = WavFormat.RIFF_HEADER_SIZE;
        int fmtOffset = -1;
        int fmtSize = 0;
        int dataOffset = -1;
        int dataSize = 0;

        while (offset + WavFormat.CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = new String(wav, offset, 4, StandardCharsets.US_ASCII);
            long chunkSize = readLEInt(wav, offset + 4) & 0xFFFFFFFFL;
            int body = offset + WavFormat.CHUNK_HEADER_SIZE;

            if ("data".equals(chunkId)) {
                dataOffset = body;
                long available = wav.length - (long) body;
                if (chunkSize > available) {
                    // Streaming writers leave the size unset; read what is there.
                    LOG.warn("WAV {} declares {} data bytes but only {} are present", source, chunkSize, available);
                    dataSize = (int) available;
                    break;
                }
                dataSize = (int) chunkSize;
            } else if (body + chunkSize > wav.length) {
                throw new DecodeException(source, "invalid chunk size " + chunkSize + " for '"
                        + chunkId + "' at offset " + offset);
            } else if ("fmt ".equals(chunkId)) {
                fmtOffset = body;
                fmtSize = (int) chunkSize;
            }
            if (fmtOffset != -1 && dataOffset != -1) {
                break;
            }
            offset = body + (int) chunkSize;
            if (chunkSize % 2 == 1) {
                offset++; // chunks are padded to even byte boundaries
            }
        }
        return new WavChunks(fmtOffset, fmtSize, dataOffset, dataSize);
    }

    private static SampleReader readerFor(int formatTag, int bits, String source) {
        if (formatTag == WavFormat.AUDIO_FORMAT_PCM) {
            switch (bits) {
                case 8:
                    return (a, p) -> ((a[p] & 0xFF) - 128) / 128.0;
                case 16:
                    return (a, p) -> ((short) readLEShort(a, p)) / 32768.0;
                case 24:
                    return (a, p) -> {
                        int v = (a[p] & 0xFF) | ((a[p + 1] & 0xFF) << 8) | (a[p + 2] << 16);
                        return v / 8388608.0;
                    };
                case 32:
                    return (a, p) -> readLEInt(a, p) / 2147483648.0;
                default:
                    break;
            }
        } else if (formatTag == WavFormat.AUDIO_FORMAT_IEEE_FLOAT) {
            if (bits == 32) {
                return (a, p) -> Float.intBitsToFloat(readLEInt(a, p));
            }
            if (bits == 64) {
                return (a, p) -> Double.longBitsToDouble(readLELong(a, p));
            }
        }
        throw new DecodeException(source, "unsupported encoding: format=" + formatTag + ", bits=" + bits);
    }

    private static DecodedAudio decodeWithJavaSound(byte[] bytes, String source) {
        try (AudioInputStream in = AudioSystem.getAudioInputStream(new ByteArrayInputStream(bytes))) {
            AudioFormat src = in.getFormat();
            AudioFormat pcm = new AudioFormat(AudioFormat.Encoding.PCM_SIGNED, src.getSampleRate(), 16,
                    src.getChannels(), src.getChannels() * 2, src.getSampleRate(), false);
            try (AudioInputStream converted = AudioSystem.getAudioInputStream(pcm, in)) {
                byte[] raw = converted.readAllBytes();
                int channels = pcm.getChannels();
                int frames = raw.length / (channels * 2);
                double[][] out = new double[channels][frames];
                int pos = 0;
                for (int i = 0; i < frames; i++) {
                    for (int c = 0; c < channels; c++) {
                        out[c][i] = ((short) readLEShort(raw, pos)) / 32768.0;
                        pos += 2;
                    }
                }
                LOG.debug("Decoded {} via Java Sound: {}", source, src);
                return new DecodedAudio(out, Math.round(src.getSampleRate()));
            }
        } catch (UnsupportedAudioFileException e) {
            throw new DecodeException(source, "unsupported audio container", e);
        } catch (IllegalArgumentException e) {
            throw new DecodeException(source, "unsupported encoding: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DecodeException(source, "read failed: " + e.getMessage(), e);
        }
    }

    static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }

    private static long readLELong(byte[] a, int off) {
        return (readLEInt(a, off) & 0xFFFFFFFFL) | ((long) readLEInt(a, off + 4) << 32);
    }

    @FunctionalInterface
    private interface SampleReader {
        double read(byte[] data, int offset);
    }

    /**
     * Container for WAV chunk locations.
     */
    private static final class WavChunks {
        final int fmtOffset;
        final int fmtSize;
        final int dataOffset;
        final int dataSize;

        WavChunks(int fmtOffset, int fmtSize, int dataOffset, int dataSize) {
            this.fmtOffset = fmtOffset;
            this.fmtSize = fmtSize;
            this.dataOffset = dataOffset;
            this.dataSize = dataSize;
        }
    }
}
