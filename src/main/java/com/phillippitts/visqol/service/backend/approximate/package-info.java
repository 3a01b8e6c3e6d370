/**
 * In-process backend running the spectrogram, patch similarity and mapping pipeline.
 *
 * <p>Always available; selected whenever the native binary or its model is missing, or when the
 * native backend fails to initialize. Scores follow the same ranges as the native backend but
 * are not expected to match it.
 *
 * @see com.phillippitts.visqol.service.backend.QualityBackend
 */
package com.phillippitts.visqol.service.backend.approximate;
