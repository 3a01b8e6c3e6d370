/**
 * Service layer: the measurement pipeline and its backends.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.audio} - WAV decoding, mono downmix and signal statistics</li>
 *   <li>{@code service.align} - Resampling to the mode rate and truncation to the common length</li>
 *   <li>{@code service.model} - Per-mode model resources (spectral layout, patching, mapping)</li>
 *   <li>{@code service.analysis} - Band spectrograms and voice activity</li>
 *   <li>{@code service.similarity} - Patch NSIM per band</li>
 *   <li>{@code service.score} - FVNSIM/VNSIM aggregation and MOS-LQO mapping</li>
 *   <li>{@code service.backend} - Native and approximate backends behind one contract</li>
 *   <li>{@code service.engine} - Engine facade, backend selection and batch entry point</li>
 *   <li>{@code service.batch} - Batch fan-out, CSV input and result writers</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>The pipeline is plain Java; Spring only wires shared collaborators</li>
 *   <li>Services throw domain exceptions from {@code com.phillippitts.visqol.exception}</li>
 *   <li>Engines and backends are safe for concurrent measurements</li>
 * </ul>
 *
 * @see com.phillippitts.visqol.service.engine.VisqolEngine
 * @since 1.0
 */
package com.phillippitts.visqol.service;
