/**
 * Immutable domain values of a quality measurement.
 *
 * <ul>
 *   <li>{@link com.phillippitts.visqol.domain.AudioInput} - path or in-memory samples</li>
 *   <li>{@link com.phillippitts.visqol.domain.QualityMode} - AUDIO (48 kHz) or SPEECH (16 kHz)</li>
 *   <li>{@link com.phillippitts.visqol.domain.MeasurementResult} - MOS-LQO, VNSIM and per-band scores</li>
 *   <li>{@link com.phillippitts.visqol.domain.MeasurementPair} and
 *       {@link com.phillippitts.visqol.domain.BatchOutcome} - batch input and output slots</li>
 * </ul>
 */
package com.phillippitts.visqol.domain;
