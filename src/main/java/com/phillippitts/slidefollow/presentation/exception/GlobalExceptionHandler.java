package com.phillippitts.slidefollow.presentation.exception;

import com.phillippitts.slidefollow.exception.FollowConfigurationException;
import com.phillippitts.slidefollow.exception.MicrophoneAccessException;
import com.phillippitts.slidefollow.exception.RecognitionAuthException;
import com.phillippitts.slidefollow.exception.RecognitionConnectionException;
import com.phillippitts.slidefollow.exception.UnknownSlideException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the follow control API.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes. Transcript text
 * and API keys never appear in a response.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Manual selection of a slide that is not in the presentation (HTTP 404).
     */
    @ExceptionHandler(UnknownSlideException.class)
    ResponseEntity<ApiError> handleUnknownSlide(UnknownSlideException ex) {
        LOG.warn("Unknown slide requested: {}", ex.getSlideId());
        return error(HttpStatus.NOT_FOUND, ex, "Slide not found", ex.getMessage());
    }

    /**
     * Client error - invalid settings or request values (HTTP 400).
     */
    @ExceptionHandler({FollowConfigurationException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        LOG.warn("Validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
    }

    /**
     * Microphone permission or device problem (HTTP 403).
     */
    @ExceptionHandler(MicrophoneAccessException.class)
    ResponseEntity<ApiError> handleMicrophone(MicrophoneAccessException ex) {
        LOG.warn("Microphone unavailable: reason={}", ex.getReason());
        return error(HttpStatus.FORBIDDEN, ex, "Microphone unavailable",
                "Check microphone permissions and device (" + ex.getReason() + ")");
    }

    /**
     * Recognition backend rejected us or could not be reached (HTTP 502).
     */
    @ExceptionHandler({RecognitionAuthException.class, RecognitionConnectionException.class})
    ResponseEntity<ApiError> handleRecognition(RuntimeException ex) {
        LOG.error("Recognition backend failure: {}", ex.getMessage());
        String details = ex instanceof RecognitionAuthException
                ? "Check recognition.api-key"
                : "Please retry in a few seconds";
        return error(HttpStatus.BAD_GATEWAY, ex, "Speech recognition unavailable", details);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    private static String describe(FieldError fe) {
        return fe.getField() + " " + fe.getDefaultMessage();
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
