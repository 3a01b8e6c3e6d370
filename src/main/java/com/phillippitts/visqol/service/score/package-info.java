/**
 * Aggregation of patch similarities into FVNSIM/VNSIM and regression to MOS-LQO.
 */
package com.phillippitts.visqol.service.score;
