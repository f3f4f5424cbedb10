/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.slidefollow.config.ThreadPoolConfig} - Follow loop executor and
 *       reconnect scheduler</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.follow} - Follow engine tuning ({@code follow.*})</li>
 *   <li>{@code config.recognition} - Recognition backend, token client and session factory
 *       ({@code recognition.*})</li>
 *   <li>{@code config.audio} - Microphone capture ({@code audio.capture.*})</li>
 *   <li>{@code config.sync} - Live slide sync client ({@code sync.*})</li>
 *   <li>{@code config.orchestration} - Orchestrator wiring</li>
 *   <li>{@code config.logging} - Logging infrastructure (MDC filter)</li>
 * </ul>
 *
 * @see com.phillippitts.slidefollow.config.ThreadPoolConfig
 * @since 1.0
 */
package com.phillippitts.slidefollow.config;
