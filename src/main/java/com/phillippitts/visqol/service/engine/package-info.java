/**
 * Measurement entry point.
 *
 * <p>{@link com.phillippitts.visqol.service.engine.VisqolEngine} wires loading, alignment and the
 * backend selected by a one-time probe. It is plain Java; Spring applications obtain engines from
 * {@link com.phillippitts.visqol.service.engine.VisqolEngineFactory}.
 */
package com.phillippitts.visqol.service.engine;
