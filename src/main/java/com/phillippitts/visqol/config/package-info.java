/**
 * Application-wide configuration beans and properties.
 *
 * <p>This package contains Spring configuration classes that define beans and load
 * externalized configuration from {@code application.properties}.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.visqol.config.ThreadPoolConfig} - bounded executor for batch
 *       measurement with MDC propagation</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.engine} - engine, native backend and model validation configuration</li>
 *   <li>{@code config.properties} - batch tuning properties</li>
 * </ul>
 *
 * @see com.phillippitts.visqol.config.engine
 */
package com.phillippitts.visqol.config;
