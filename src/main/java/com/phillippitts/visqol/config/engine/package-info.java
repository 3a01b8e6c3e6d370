/**
 * Engine configuration: {@code visqol.*} and {@code visqol.native.*} properties, shared engine
 * collaborators, and fail-fast model validation at startup.
 */
package com.phillippitts.visqol.config.engine;
