/**
 * Signal loading: file decoding, in-memory sample validation, downmixing and WAV writing.
 *
 * <p>{@link com.phillippitts.visqol.service.audio.SignalLoader} is the entry point; every later
 * stage works on mono {@link com.phillippitts.visqol.service.audio.AudioBuffer} values.
 */
package com.phillippitts.visqol.service.audio;
