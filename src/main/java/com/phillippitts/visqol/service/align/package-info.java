/**
 * Brings a reference/degraded pair to the mode's sample rate and a common length.
 */
package com.phillippitts.visqol.service.align;
