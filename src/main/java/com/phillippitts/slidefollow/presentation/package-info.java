/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over
 * {@link com.phillippitts.slidefollow.service.orchestration.SlideFollowOrchestrator}; domain
 * exceptions are mapped to HTTP status codes by
 * {@link com.phillippitts.slidefollow.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.slidefollow.presentation;
