package com.phillippitts.visqol.service.audio;

/**
 * Channel-major samples as read from a container, before downmixing.
 *
 * @param channels   samples per channel, {@code channels[c][i]}, all the same length
 * @param sampleRate sample rate in Hz
 */
record DecodedAudio(double[][] channels, int sampleRate) {
}
