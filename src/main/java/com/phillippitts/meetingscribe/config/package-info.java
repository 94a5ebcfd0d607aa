/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.config.ThreadPoolConfig} - manager, persistence and
 *       recovery executors</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - externalized {@code transcription.*} and {@code threadpool.*}
 *       properties</li>
 *   <li>{@code config.transcription} - startup checks of the transcription installation</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.config;
