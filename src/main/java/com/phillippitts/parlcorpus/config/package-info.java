/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.parlcorpus.config.PipelineConfig} - Pipeline components built
 *       from typed properties</li>
 *   <li>{@link com.phillippitts.parlcorpus.config.ThreadPoolConfig} - Bounded executor for
 *       per-session tasks</li>
 *   <li>{@link com.phillippitts.parlcorpus.config.ThreadPoolMetricsConfig} - Micrometer gauges
 *       for the session pool</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} classes</li>
 * </ul>
 */
package com.phillippitts.parlcorpus.config;
