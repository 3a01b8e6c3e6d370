/**
 * Backend abstraction for similarity scoring and quality mapping.
 *
 * <p>{@link com.phillippitts.visqol.service.backend.QualityBackend} has two implementations: the
 * external reference binary ({@code visqolcli}) and the in-process pipeline ({@code approximate}).
 * A {@link com.phillippitts.visqol.service.backend.BackendProbe} decides once per engine which
 * one is used, and the outcome is reported as a
 * {@link com.phillippitts.visqol.service.backend.BackendStatus}.
 */
package com.phillippitts.visqol.service.backend;
