/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.callrelay.config.ThreadPoolConfig} - pipeline and capability
 *       executors, the per-call work queue and the task scheduler</li>
 *   <li>{@link com.phillippitts.callrelay.config.ThreadPoolMetricsConfig} - pool and table gauges</li>
 *   <li>{@link com.phillippitts.callrelay.config.WebSocketConfig} - socket endpoint registration</li>
 *   <li>{@link com.phillippitts.callrelay.config.CapabilityConfig} - fallback capability beans</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code relay.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.phillippitts.callrelay.config;
