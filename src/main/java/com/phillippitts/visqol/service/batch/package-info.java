/**
 * Batch measurement: ordered fan-out with per-pair isolation and timeout, pair-list CSV input,
 * and CSV/JSON result export.
 */
package com.phillippitts.visqol.service.batch;
