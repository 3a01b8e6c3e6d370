/**
 * STFT analysis into ERB-spaced gammatone bands with energy-based voice-activity marking.
 */
package com.phillippitts.visqol.service.analysis;
