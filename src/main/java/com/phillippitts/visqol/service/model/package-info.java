/**
 * Versioned per-mode model resources: STFT framing, band layout, patch geometry, voice-activity
 * rule and the monotone VNSIM to MOS-LQO mapping.
 *
 * <p>Resources live under {@code model/} on the classpath as {@code visqol-<mode>-<version>.json}
 * and may be overridden from an external directory.
 */
package com.phillippitts.visqol.service.model;
