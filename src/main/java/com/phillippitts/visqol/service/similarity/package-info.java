/**
 * Patch-based structural similarity between reference and degraded spectrograms.
 */
package com.phillippitts.visqol.service.similarity;
