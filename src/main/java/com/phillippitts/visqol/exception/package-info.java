/**
 * Measurement exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.visqol.exception.VisqolException} and expose an
 * {@link com.phillippitts.visqol.exception.ErrorKind}, which batch processing records as the failure
 * marker of a pair.
 * <ul>
 *   <li>{@link com.phillippitts.visqol.exception.InvalidInputException} - unsupported input type,
 *       empty or non-finite samples, impossible rate conversion</li>
 *   <li>{@link com.phillippitts.visqol.exception.DecodeException} - unreadable or unsupported file</li>
 *   <li>{@link com.phillippitts.visqol.exception.EmptyAudioException} - nothing left to compare</li>
 *   <li>{@link com.phillippitts.visqol.exception.AlignmentException} - spectrogram shape mismatch</li>
 *   <li>{@link com.phillippitts.visqol.exception.ModelLoadException} - missing or corrupt model resource</li>
 *   <li>{@link com.phillippitts.visqol.exception.BackendUnavailableException} - reason the native
 *       backend was not selected (status only)</li>
 *   <li>{@link com.phillippitts.visqol.exception.MeasurementException} - selected backend failed</li>
 * </ul>
 */
package com.phillippitts.visqol.exception;
