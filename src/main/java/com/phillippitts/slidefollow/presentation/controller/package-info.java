/**
 * REST API controllers for the operator console.
 *
 * <p>Current Endpoints (under {@code /api/follow}):
 * <ul>
 *   <li>{@code GET /state} - live slide, window size, matching switch, session state</li>
 *   <li>{@code PUT /slides} - replace the presentation</li>
 *   <li>{@code POST /slides/{id}/select} - manual override</li>
 *   <li>{@code POST /matching?allowed=} - suspend or resume automatic changes</li>
 *   <li>{@code POST /reset} - clear follow state</li>
 *   <li>{@code POST /listening/start}, {@code POST /listening/stop}</li>
 * </ul>
 *
 * @see com.phillippitts.slidefollow.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.slidefollow.presentation.controller;
