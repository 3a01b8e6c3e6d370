/**
 * High-fidelity backend driving the reference {@code visqol} command-line binary.
 */
package com.phillippitts.visqol.service.backend.visqolcli;
