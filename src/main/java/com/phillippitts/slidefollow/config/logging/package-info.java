/**
 * Logging infrastructure and ThreadContext (MDC) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - one per control request, from {@code X-Request-ID} or a fresh UUID</li>
 *   <li>{@code segmentId} - transcript segment being evaluated on the follow loop</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2024-05-05 10:00:00.123 [follow-loop-1] [requestId] [segmentId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.slidefollow.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.slidefollow.config.logging;
