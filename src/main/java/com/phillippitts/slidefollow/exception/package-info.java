/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.slidefollow.exception.SlideFollowException}:
 * <ul>
 *   <li>{@link com.phillippitts.slidefollow.exception.MicrophoneAccessException} - microphone
 *       permission denied or no input line</li>
 *   <li>{@link com.phillippitts.slidefollow.exception.RecognitionAuthException} - backend rejected
 *       the credentials</li>
 *   <li>{@link com.phillippitts.slidefollow.exception.RecognitionConnectionException} - connect,
 *       handshake timeout or unexpected close</li>
 *   <li>{@link com.phillippitts.slidefollow.exception.RecognitionProtocolException} - malformed
 *       backend message; logged and skipped</li>
 *   <li>{@link com.phillippitts.slidefollow.exception.FollowConfigurationException} - follow
 *       settings out of range</li>
 *   <li>{@link com.phillippitts.slidefollow.exception.UnknownSlideException} - manual selection
 *       of a slide that does not exist</li>
 * </ul>
 *
 * <p>Recognition failures reach listeners through
 * {@code RecognitionListener#onError}; REST callers see them mapped by
 * {@code GlobalExceptionHandler}.
 */
package com.phillippitts.slidefollow.exception;
